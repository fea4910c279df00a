package com.csv2bufr.mapping;

import com.csv2bufr.model.FieldValue;

import java.util.Objects;

/**
 * Where a mapped field takes its value from. Chosen once when the mapping is loaded.
 */
public abstract class FieldSource {

    public enum SourceType {
        /**
         * Fixed value from the mapping document. Never scaled or range checked.
         */
        LITERAL,

        /**
         * Value read from a CSV column (or merged station metadata) for each row.
         */
        COLUMN,

        /**
         * Declared in the mapping without a source; always encoded as missing.
         */
        UNSET
    }

    private FieldSource() {
    }

    public abstract SourceType getType();

    public static FieldSource literal(FieldValue value) {
        return new Literal(value);
    }

    public static FieldSource column(String name) {
        return new ColumnRef(name);
    }

    public static FieldSource unset() {
        return Unset.INSTANCE;
    }

    public boolean isLiteral() {
        return getType() == SourceType.LITERAL;
    }

    public boolean isColumn() {
        return getType() == SourceType.COLUMN;
    }

    /**
     * Literal value; only valid for {@link SourceType#LITERAL}.
     */
    public FieldValue getLiteral() {
        throw new IllegalStateException(getType() + " source has no literal value");
    }

    /**
     * Column name; only valid for {@link SourceType#COLUMN}.
     */
    public String getColumn() {
        throw new IllegalStateException(getType() + " source has no column");
    }

    static final class Literal extends FieldSource {
        private final FieldValue value;

        Literal(FieldValue value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public SourceType getType() {
            return SourceType.LITERAL;
        }

        @Override
        public FieldValue getLiteral() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "value=" + value;
        }
    }

    static final class ColumnRef extends FieldSource {
        private final String name;

        ColumnRef(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public SourceType getType() {
            return SourceType.COLUMN;
        }

        @Override
        public String getColumn() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ColumnRef other && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "column=" + name;
        }
    }

    static final class Unset extends FieldSource {
        static final Unset INSTANCE = new Unset();

        @Override
        public SourceType getType() {
            return SourceType.UNSET;
        }

        @Override
        public String toString() {
            return "unset";
        }
    }
}
