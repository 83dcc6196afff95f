package com.phillippitts.keycodes.domain;

import com.phillippitts.keycodes.exception.UnknownKeyCodeException;

import java.util.Optional;

/**
 * Physical key positions on keyboards and gamepads, independent of the active layout.
 *
 * <p>The vocabulary follows the W3C UI Events {@code code} values. Each constant carries
 * its canonical name (the only spelling ever written out, see {@link #code()}) and a
 * baseline label describing the key on a US QWERTY keyboard (see {@link #label()}).
 * Legacy spellings such as {@code "OSLeft"} are accepted on input by {@link KeyCodeParser}.
 *
 * <p>All members are immutable constants and safe to share across threads.
 */
public enum KeyCode {

    // Writing system keys
    BACKQUOTE("Backquote", "`"),
    BACKSLASH("Backslash", "\\"),
    BACKSPACE("Backspace", "⌫"),
    BRACKET_LEFT("BracketLeft", "["),
    BRACKET_RIGHT("BracketRight", "]"),
    COMMA("Comma", ","),
    DIGIT_0("Digit0", "0"),
    DIGIT_1("Digit1", "1"),
    DIGIT_2("Digit2", "2"),
    DIGIT_3("Digit3", "3"),
    DIGIT_4("Digit4", "4"),
    DIGIT_5("Digit5", "5"),
    DIGIT_6("Digit6", "6"),
    DIGIT_7("Digit7", "7"),
    DIGIT_8("Digit8", "8"),
    DIGIT_9("Digit9", "9"),
    EQUAL("Equal", "="),
    INTL_BACKSLASH("IntlBackslash", "International Backslash"),
    INTL_RO("IntlRo", "ろ"),
    INTL_YEN("IntlYen", "¥"),
    KEY_A("KeyA", "A"),
    KEY_B("KeyB", "B"),
    KEY_C("KeyC", "C"),
    KEY_D("KeyD", "D"),
    KEY_E("KeyE", "E"),
    KEY_F("KeyF", "F"),
    KEY_G("KeyG", "G"),
    KEY_H("KeyH", "H"),
    KEY_I("KeyI", "I"),
    KEY_J("KeyJ", "J"),
    KEY_K("KeyK", "K"),
    KEY_L("KeyL", "L"),
    KEY_M("KeyM", "M"),
    KEY_N("KeyN", "N"),
    KEY_O("KeyO", "O"),
    KEY_P("KeyP", "P"),
    KEY_Q("KeyQ", "Q"),
    KEY_R("KeyR", "R"),
    KEY_S("KeyS", "S"),
    KEY_T("KeyT", "T"),
    KEY_U("KeyU", "U"),
    KEY_V("KeyV", "V"),
    KEY_W("KeyW", "W"),
    KEY_X("KeyX", "X"),
    KEY_Y("KeyY", "Y"),
    KEY_Z("KeyZ", "Z"),
    MINUS("Minus", "-"),
    PERIOD("Period", "."),
    QUOTE("Quote", "'"),
    SEMICOLON("Semicolon", ";"),
    SLASH("Slash", "/"),

    // Functional keys
    ALT_LEFT("AltLeft", "Alt Left"),
    ALT_RIGHT("AltRight", "Alt Right"),
    CAPS_LOCK("CapsLock", "⇪"),
    CONTEXT_MENU("ContextMenu", "Context Menu"),
    CONTROL_LEFT("ControlLeft", "Control Left"),
    CONTROL_RIGHT("ControlRight", "Control Right"),
    ENTER("Enter", "↵"),
    META_LEFT("MetaLeft", "⌘ Left"), // reported as "OSLeft" by Firefox, Chrome < 52 and WebKitGTK/WPE
    META_RIGHT("MetaRight", "⌘ Right"), // reported as "OSRight" by Firefox, Chrome < 52 and WebKitGTK/WPE
    SHIFT_LEFT("ShiftLeft", "⇧ Left"),
    SHIFT_RIGHT("ShiftRight", "⇧ Right"),
    SPACE("Space", "Space"),
    TAB("Tab", "⇥"),

    // IME keys of Japanese and Korean keyboards
    CONVERT("Convert", "変換"),
    KANA_MODE("KanaMode", "カタカナ/ひらがな/ローマ字"),
    LANG_1("Lang1", "한/영 かな"),
    LANG_2("Lang2", "한자 英数"),
    LANG_3("Lang3", "カタカナ"),
    LANG_4("Lang4", "ひらがな"),
    LANG_5("Lang5", "半角/全角/漢字"),
    NON_CONVERT("NonConvert", "無変換"),

    // Control pad
    DELETE("Delete", "Delete"),
    END("End", "End"),
    HELP("Help", "Help"),
    HOME("Home", "Home"),
    INSERT("Insert", "Insert"),
    PAGE_DOWN("PageDown", "Page Down"),
    PAGE_UP("PageUp", "Page Up"),

    // Arrow pad
    ARROW_DOWN("ArrowDown", "↓"),
    ARROW_LEFT("ArrowLeft", "←"),
    ARROW_RIGHT("ArrowRight", "→"),
    ARROW_UP("ArrowUp", "↑"),

    // Numpad
    NUM_LOCK("NumLock", "Num Lock"),
    NUMPAD_0("Numpad0", "Numpad 0"),
    NUMPAD_1("Numpad1", "Numpad 1"),
    NUMPAD_2("Numpad2", "Numpad 2"),
    NUMPAD_3("Numpad3", "Numpad 3"),
    NUMPAD_4("Numpad4", "Numpad 4"),
    NUMPAD_5("Numpad5", "Numpad 5"),
    NUMPAD_6("Numpad6", "Numpad 6"),
    NUMPAD_7("Numpad7", "Numpad 7"),
    NUMPAD_8("Numpad8", "Numpad 8"),
    NUMPAD_9("Numpad9", "Numpad 9"),
    NUMPAD_ADD("NumpadAdd", "Numpad +"),
    NUMPAD_BACKSPACE("NumpadBackspace", "Numpad ⌫"),
    NUMPAD_CLEAR("NumpadClear", "Numpad C"),
    NUMPAD_CLEAR_ENTRY("NumpadClearEntry", "Numpad CE"),
    NUMPAD_COMMA("NumpadComma", "Numpad ,"),
    NUMPAD_DECIMAL("NumpadDecimal", "Numpad ."),
    NUMPAD_DIVIDE("NumpadDivide", "Numpad /"),
    NUMPAD_ENTER("NumpadEnter", "Numpad ↵"),
    NUMPAD_EQUAL("NumpadEqual", "Numpad ="),
    NUMPAD_HASH("NumpadHash", "Numpad #"),
    NUMPAD_MEMORY_ADD("NumpadMemoryAdd", "Numpad M+"),
    NUMPAD_MEMORY_CLEAR("NumpadMemoryClear", "Numpad MC"),
    NUMPAD_MEMORY_RECALL("NumpadMemoryRecall", "Numpad MR"),
    NUMPAD_MEMORY_STORE("NumpadMemoryStore", "Numpad MS"),
    NUMPAD_MEMORY_SUBTRACT("NumpadMemorySubtract", "Numpad M-"),
    NUMPAD_MULTIPLY("NumpadMultiply", "Numpad *"),
    NUMPAD_PAREN_LEFT("NumpadParenLeft", "Numpad ("),
    NUMPAD_PAREN_RIGHT("NumpadParenRight", "Numpad )"),
    NUMPAD_STAR("NumpadStar", "Numpad * (Star)"),
    NUMPAD_SUBTRACT("NumpadSubtract", "Numpad -"),

    // Function section
    ESCAPE("Escape", "Escape"),
    F1("F1", "F1"),
    F2("F2", "F2"),
    F3("F3", "F3"),
    F4("F4", "F4"),
    F5("F5", "F5"),
    F6("F6", "F6"),
    F7("F7", "F7"),
    F8("F8", "F8"),
    F9("F9", "F9"),
    F10("F10", "F10"),
    F11("F11", "F11"),
    F12("F12", "F12"),
    F13("F13", "F13"),
    F14("F14", "F14"),
    F15("F15", "F15"),
    F16("F16", "F16"),
    F17("F17", "F17"),
    F18("F18", "F18"),
    F19("F19", "F19"),
    F20("F20", "F20"),
    F21("F21", "F21"),
    F22("F22", "F22"),
    F23("F23", "F23"),
    F24("F24", "F24"),
    FN("Fn", "Fn"),
    FN_LOCK("FnLock", "FnLock"),
    PRINT_SCREEN("PrintScreen", "Print Screen"),
    SCROLL_LOCK("ScrollLock", "Scroll Lock"),
    PAUSE("Pause", "Pause Break"),

    // Media keys
    BROWSER_BACK("BrowserBack", "Browser ⏮"),
    BROWSER_FAVORITES("BrowserFavorites", "Browser Favorites"),
    BROWSER_FORWARD("BrowserForward", "Browser ⏭"),
    BROWSER_HOME("BrowserHome", "Browser 🏠"),
    BROWSER_REFRESH("BrowserRefresh", "Browser Refresh"),
    BROWSER_SEARCH("BrowserSearch", "Browser Search"),
    BROWSER_STOP("BrowserStop", "Browser Stop"),
    EJECT("Eject", "⏏"),
    LAUNCH_APP_1("LaunchApp1", "Launch App 1"),
    LAUNCH_APP_2("LaunchApp2", "Launch App 2"),
    LAUNCH_MAIL("LaunchMail", "Launch Mail"),
    MEDIA_PLAY_PAUSE("MediaPlayPause", "⏯"),
    MEDIA_SELECT("MediaSelect", "Media Select"), // reported as "LaunchMediaPlayer" by WebKitGTK/WPE
    MEDIA_STOP("MediaStop", "◼"),
    MEDIA_TRACK_NEXT("MediaTrackNext", "⏭"),
    MEDIA_TRACK_PREVIOUS("MediaTrackPrevious", "⏮"),
    POWER("Power", "Power"),
    SLEEP("Sleep", "Sleep"),
    AUDIO_VOLUME_DOWN("AudioVolumeDown", "🔉"), // older engines report "VolumeDown"
    AUDIO_VOLUME_MUTE("AudioVolumeMute", "🔇"), // older engines report "VolumeMute"
    AUDIO_VOLUME_UP("AudioVolumeUp", "🔊"), // older engines report "VolumeUp"
    WAKE_UP("WakeUp", "Wake Up"),

    // Legacy editing keys
    AGAIN("Again", "Again"),
    COPY("Copy", "Copy"),
    CUT("Cut", "Cut"),
    FIND("Find", "Find"),
    OPEN("Open", "Open"),
    PASTE("Paste", "Paste"),
    PROPS("Props", "Props"),
    SELECT("Select", "Select"),
    UNDO("Undo", "Undo"),

    // Gamepad buttons
    GAMEPAD_0("Gamepad0", "Gamepad 0"),
    GAMEPAD_1("Gamepad1", "Gamepad 1"),
    GAMEPAD_2("Gamepad2", "Gamepad 2"),
    GAMEPAD_3("Gamepad3", "Gamepad 3"),
    GAMEPAD_4("Gamepad4", "Gamepad 4"),
    GAMEPAD_5("Gamepad5", "Gamepad 5"),
    GAMEPAD_6("Gamepad6", "Gamepad 6"),
    GAMEPAD_7("Gamepad7", "Gamepad 7"),
    GAMEPAD_8("Gamepad8", "Gamepad 8"),
    GAMEPAD_9("Gamepad9", "Gamepad 9"),
    GAMEPAD_10("Gamepad10", "Gamepad 10"),
    GAMEPAD_11("Gamepad11", "Gamepad 11"),
    GAMEPAD_12("Gamepad12", "Gamepad 12"),
    GAMEPAD_13("Gamepad13", "Gamepad 13"),
    GAMEPAD_14("Gamepad14", "Gamepad 14"),
    GAMEPAD_15("Gamepad15", "Gamepad 15"),
    GAMEPAD_16("Gamepad16", "Gamepad 16"),
    GAMEPAD_17("Gamepad17", "Gamepad 17"),
    GAMEPAD_18("Gamepad18", "Gamepad 18"),
    GAMEPAD_19("Gamepad19", "Gamepad 19"),

    // Browser specific keys, only reported by Chromium
    BRIGHTNESS_DOWN("BrightnessDown", "Brightness Down"),
    BRIGHTNESS_UP("BrightnessUp", "Brightness Up"),
    DISPLAY_TOGGLE_INT_EXT("DisplayToggleIntExt", "Display Toggle Intern / Extern"),
    KEYBOARD_LAYOUT_SELECT("KeyboardLayoutSelect", "Keyboard Layout Select"),
    LAUNCH_ASSISTANT("LaunchAssistant", "Launch Assistant"),
    LAUNCH_CONTROL_PANEL("LaunchControlPanel", "Launch Control Panel"),
    LAUNCH_SCREEN_SAVER("LaunchScreenSaver", "Launch Screen Saver"),
    MAIL_FORWARD("MailForward", "Mail Forward"),
    MAIL_REPLY("MailReply", "Mail Reply"),
    MAIL_SEND("MailSend", "Mail Send"),
    MEDIA_FAST_FORWARD("MediaFastForward", "⏩"),
    MEDIA_PAUSE("MediaPause", "⏸"),
    MEDIA_PLAY("MediaPlay", "▶"),
    MEDIA_RECORD("MediaRecord", "⏺"),
    MEDIA_REWIND("MediaRewind", "⏪"),
    PRIVACY_SCREEN_TOGGLE("PrivacyScreenToggle", "Privacy Screen Toggle"),
    SELECT_TASK("SelectTask", "Select Task"),
    SHOW_ALL_WINDOWS("ShowAllWindows", "Show All Windows"),
    ZOOM_TOGGLE("ZoomToggle", "Zoom Toggle");

    private final String code;
    private final String label;

    KeyCode(String code, String label) {
        this.code = code;
        this.label = label;
    }

    /** Canonical name, e.g. {@code "KeyA"} or {@code "ArrowUp"}. Used for persistence. */
    public String code() {
        return code;
    }

    /**
     * Display label for a US QWERTY keyboard. Never empty.
     * Layout-aware labels are produced by
     * {@link com.phillippitts.keycodes.layout.KeyLabelResolver}.
     */
    public String label() {
        return label;
    }

    /** @return the category this key belongs to */
    public KeyCodeClass classify() {
        // No default arm: the compiler rejects this switch if a constant is missing.
        return switch (this) {
            case BACKQUOTE, BACKSLASH, BACKSPACE, BRACKET_LEFT, BRACKET_RIGHT, COMMA, DIGIT_0,
                    DIGIT_1, DIGIT_2, DIGIT_3, DIGIT_4, DIGIT_5, DIGIT_6, DIGIT_7, DIGIT_8,
                    DIGIT_9, EQUAL, INTL_BACKSLASH, INTL_RO, INTL_YEN, KEY_A, KEY_B, KEY_C, KEY_D,
                    KEY_E, KEY_F, KEY_G, KEY_H, KEY_I, KEY_J, KEY_K, KEY_L, KEY_M, KEY_N, KEY_O,
                    KEY_P, KEY_Q, KEY_R, KEY_S, KEY_T, KEY_U, KEY_V, KEY_W, KEY_X, KEY_Y, KEY_Z,
                    MINUS, PERIOD, QUOTE, SEMICOLON, SLASH -> KeyCodeClass.WRITING_SYSTEM;
            case ALT_LEFT, ALT_RIGHT, CAPS_LOCK, CONTEXT_MENU, CONTROL_LEFT, CONTROL_RIGHT, ENTER,
                    META_LEFT, META_RIGHT, SHIFT_LEFT, SHIFT_RIGHT, SPACE, TAB, CONVERT, KANA_MODE,
                    LANG_1, LANG_2, LANG_3, LANG_4, LANG_5, NON_CONVERT -> KeyCodeClass.FUNCTIONAL;
            case DELETE, END, HELP, HOME, INSERT, PAGE_DOWN, PAGE_UP -> KeyCodeClass.CONTROL_PAD;
            case ARROW_DOWN, ARROW_LEFT, ARROW_RIGHT, ARROW_UP -> KeyCodeClass.ARROW_PAD;
            case NUM_LOCK, NUMPAD_0, NUMPAD_1, NUMPAD_2, NUMPAD_3, NUMPAD_4, NUMPAD_5, NUMPAD_6,
                    NUMPAD_7, NUMPAD_8, NUMPAD_9, NUMPAD_ADD, NUMPAD_BACKSPACE, NUMPAD_CLEAR,
                    NUMPAD_CLEAR_ENTRY, NUMPAD_COMMA, NUMPAD_DECIMAL, NUMPAD_DIVIDE, NUMPAD_ENTER,
                    NUMPAD_EQUAL, NUMPAD_HASH, NUMPAD_MEMORY_ADD, NUMPAD_MEMORY_CLEAR,
                    NUMPAD_MEMORY_RECALL, NUMPAD_MEMORY_STORE, NUMPAD_MEMORY_SUBTRACT,
                    NUMPAD_MULTIPLY, NUMPAD_PAREN_LEFT, NUMPAD_PAREN_RIGHT, NUMPAD_STAR,
                    NUMPAD_SUBTRACT -> KeyCodeClass.NUMPAD;
            case ESCAPE, F1, F2, F3, F4, F5, F6, F7, F8, F9, F10, F11, F12, F13, F14, F15, F16,
                    F17, F18, F19, F20, F21, F22, F23, F24, FN, FN_LOCK, PRINT_SCREEN, SCROLL_LOCK,
                    PAUSE -> KeyCodeClass.FUNCTION;
            case BROWSER_BACK, BROWSER_FAVORITES, BROWSER_FORWARD, BROWSER_HOME, BROWSER_REFRESH,
                    BROWSER_SEARCH, BROWSER_STOP, EJECT, LAUNCH_APP_1, LAUNCH_APP_2, LAUNCH_MAIL,
                    MEDIA_PLAY_PAUSE, MEDIA_SELECT, MEDIA_STOP, MEDIA_TRACK_NEXT,
                    MEDIA_TRACK_PREVIOUS, POWER, SLEEP, AUDIO_VOLUME_DOWN, AUDIO_VOLUME_MUTE,
                    AUDIO_VOLUME_UP, WAKE_UP -> KeyCodeClass.MEDIA;
            case AGAIN, COPY, CUT, FIND, OPEN, PASTE, PROPS, SELECT, UNDO -> KeyCodeClass.LEGACY;
            case GAMEPAD_0, GAMEPAD_1, GAMEPAD_2, GAMEPAD_3, GAMEPAD_4, GAMEPAD_5, GAMEPAD_6,
                    GAMEPAD_7, GAMEPAD_8, GAMEPAD_9, GAMEPAD_10, GAMEPAD_11, GAMEPAD_12,
                    GAMEPAD_13, GAMEPAD_14, GAMEPAD_15, GAMEPAD_16, GAMEPAD_17, GAMEPAD_18,
                    GAMEPAD_19 -> KeyCodeClass.GAMEPAD;
            case BRIGHTNESS_DOWN, BRIGHTNESS_UP, DISPLAY_TOGGLE_INT_EXT, KEYBOARD_LAYOUT_SELECT,
                    LAUNCH_ASSISTANT, LAUNCH_CONTROL_PANEL, LAUNCH_SCREEN_SAVER, MAIL_FORWARD,
                    MAIL_REPLY, MAIL_SEND, MEDIA_FAST_FORWARD, MEDIA_PAUSE, MEDIA_PLAY,
                    MEDIA_RECORD, MEDIA_REWIND, PRIVACY_SCREEN_TOGGLE, SELECT_TASK,
                    SHOW_ALL_WINDOWS, ZOOM_TOGGLE -> KeyCodeClass.NON_STANDARD;
        };
    }

    /**
     * Looks up a key by canonical name or accepted alias.
     *
     * @param text key name, matched exactly (case-sensitive, no trimming)
     * @return the key, or empty if the text is not recognized
     */
    public static Optional<KeyCode> parse(String text) {
        return KeyCodeParser.parse(text);
    }

    /**
     * Like {@link #parse(String)}, but fails for unrecognized text.
     *
     * @throws UnknownKeyCodeException if the text names no key
     */
    public static KeyCode fromCode(String text) {
        return KeyCodeParser.parse(text).orElseThrow(() -> new UnknownKeyCodeException(text));
    }

    @Override
    public String toString() {
        return code;
    }
}
