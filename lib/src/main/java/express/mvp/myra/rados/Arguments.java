package express.mvp.myra.rados;

import express.mvp.myra.rados.error.RadosException;

/** Entry checks shared by the operations that take names. */
final class Arguments {

    private Arguments() {
        // Utility class
    }

    static String requireName(String value, String what) {
        if (value == null) {
            throw RadosException.invalidArgument(what + " must be a string");
        }
        return checkNoNul(value, what);
    }

    static String checkNoNul(String value, String what) {
        if (value.indexOf('\0') >= 0) {
            throw RadosException.invalidArgument(what + " must not contain NUL characters");
        }
        return value;
    }
}
