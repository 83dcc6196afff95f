/**
 * REST boundary: the read-only key catalogue and the mapping of domain exceptions to HTTP responses.
 */
package com.phillippitts.keycodes.presentation;
