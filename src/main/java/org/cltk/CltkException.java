/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;


/**
 * The root of all errors raised by the library itself, as opposed to the
 * I/O errors of the resources it loads.
 */
public class CltkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CltkException(String message) {
        super(message);
    }

    public CltkException(String message, Throwable cause) {
        super(message, cause);
    }
}
