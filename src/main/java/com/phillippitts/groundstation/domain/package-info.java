/**
 * Immutable value types exchanged with satellites, the broker and the speech services.
 *
 * <p>All types are records mapped with Jackson annotations to the snake_case wire format.
 */
package com.phillippitts.groundstation.domain;
