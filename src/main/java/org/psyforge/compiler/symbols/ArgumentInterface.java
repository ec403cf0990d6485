package org.psyforge.compiler.symbols;

/**
 * The symbol is a dummy argument of the enclosing routine.
 *
 * @param access The declared intent of the argument.
 */
public record ArgumentInterface(Access access) implements SymbolInterface {

    /**
     * Declared intent of an argument.
     */
    public enum Access {
        READ("in"),
        WRITE("out"),
        READWRITE("inout"),
        UNKNOWN(null);

        private final String intent;

        Access(String intent) {
            this.intent = intent;
        }

        /**
         * @return The Fortran intent keyword, or null if none is declared.
         */
        public String intent() {
            return intent;
        }

        /**
         * @param intent A Fortran intent keyword, case-insensitive.
         * @return The matching access.
         * @throws IllegalArgumentException if the keyword is not a valid intent.
         */
        public static Access fromIntent(String intent) {
            for (Access access : values()) {
                if (access.intent != null && access.intent.equalsIgnoreCase(intent.replace(" ", ""))) {
                    return access;
                }
            }
            throw new IllegalArgumentException("Unknown intent '" + intent + "'.");
        }
    }

    public ArgumentInterface {
        if (access == null) {
            throw new IllegalArgumentException("An ArgumentInterface requires an access.");
        }
    }
}
