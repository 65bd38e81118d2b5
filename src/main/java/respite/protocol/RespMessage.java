package respite.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A decoded RESP value: simple string, bulk string or array.
 * The same types describe replies before they are encoded.
 */
public abstract class RespMessage {

    private RespMessage() { }

    /** Plain-text form used when the message is a command name or argument. */
    public abstract String text();

    public static SimpleString simple(String text) {
        return new SimpleString(text);
    }

    public static BulkString bulk(String text) {
        return new BulkString(text);
    }

    public static BulkString nullBulk() {
        return BulkString.NULL;
    }

    public static Array array(List<RespMessage> elements) {
        return new Array(elements);
    }

    public static Array bulkArray(List<String> values) {
        List<RespMessage> elements = new ArrayList<>(values.size());
        for (String v : values) {
            elements.add(new BulkString(v));
        }
        return new Array(elements);
    }

    public static final class SimpleString extends RespMessage {
        private final String value;

        public SimpleString(String value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getValue() {
            return value;
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SimpleString)) return false;
            return value.equals(((SimpleString) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "SimpleString(" + value + ")";
        }
    }

    /** Bulk string; a {@code null} value is the absent ("nil") bulk string. */
    public static final class BulkString extends RespMessage {
        static final BulkString NULL = new BulkString(null);

        private final String value;

        public BulkString(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public boolean isNull() {
            return value == null;
        }

        @Override
        public String text() {
            return value == null ? "" : value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BulkString)) return false;
            return Objects.equals(value, ((BulkString) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return value == null ? "BulkString(nil)" : "BulkString(" + value + ")";
        }
    }

    public static final class Array extends RespMessage {
        private final List<RespMessage> elements;

        public Array(List<RespMessage> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public List<RespMessage> getElements() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        // Nested arrays flatten to their elements' texts, space separated.
        @Override
        public String text() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(elements.get(i).text());
            }
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array)) return false;
            return elements.equals(((Array) o).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return "Array" + elements;
        }
    }
}
