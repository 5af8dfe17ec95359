package org.apipulse.scheduling;

/**
 * A parsed interval expression such as {@code 5m}, {@code 1h} or {@code 1d}.
 */
public record Interval(long amount, Unit unit) {

    public enum Unit {
        MINUTES('m'),
        HOURS('h'),
        DAYS('d');

        private final char symbol;

        Unit(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        static Unit of(char symbol) {
            for (Unit u : values()) {
                if (u.symbol == symbol) return u;
            }
            throw new IllegalArgumentException("Unknown unit " + symbol);
        }
    }

    @Override
    public String toString() {
        return amount + String.valueOf(unit.symbol());
    }
}
