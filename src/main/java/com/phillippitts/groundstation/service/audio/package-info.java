/**
 * Satellite audio helpers: PCM16LE layout, conversion to float32 for speech-to-text, and the
 * error tone.
 *
 * <p>Satellites stream 16-bit signed little-endian PCM at the sample rate announced in their
 * handshake. Nothing here holds state.
 */
package com.phillippitts.groundstation.service.audio;
