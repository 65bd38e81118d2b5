package respite.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * RESP reply serialization. Every text payload has its CR and LF characters
 * removed before its length is computed, so a declared length always matches
 * the bytes that follow it.
 */
public class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';

    static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    public static byte[] simpleString(String s) {
        return line(SIMPLE_STRING, stripLineBreaks(s));
    }

    public static byte[] error(String s) {
        return line(ERROR, stripLineBreaks(s));
    }

    /** Encodes a present value. Nil goes through {@link #nullBulkString()}. */
    public static byte[] bulkString(String s) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        writeBulk(bos, s);
        return bos.toByteArray();
    }

    public static byte[] nullBulkString() {
        return NULL_BULK.clone();
    }

    public static byte[] array(List<String> values) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        writeHeader(bos, ARRAY, values.size());
        for (String v : values) {
            writeBulk(bos, v);
        }
        return bos.toByteArray();
    }

    public static byte[] encode(RespMessage msg) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        write(bos, msg);
        return bos.toByteArray();
    }

    public static String stripLineBreaks(String s) {
        if (s.indexOf('\r') < 0 && s.indexOf('\n') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\r' && c != '\n') sb.append(c);
        }
        return sb.toString();
    }

    private static void write(ByteArrayOutputStream bos, RespMessage msg) {
        if (msg instanceof RespMessage.SimpleString) {
            bos.writeBytes(simpleString(((RespMessage.SimpleString) msg).getValue()));
        } else if (msg instanceof RespMessage.BulkString) {
            RespMessage.BulkString bulk = (RespMessage.BulkString) msg;
            if (bulk.isNull()) {
                bos.writeBytes(NULL_BULK);
            } else {
                writeBulk(bos, bulk.getValue());
            }
        } else if (msg instanceof RespMessage.Array) {
            List<RespMessage> elements = ((RespMessage.Array) msg).getElements();
            writeHeader(bos, ARRAY, elements.size());
            for (RespMessage element : elements) {
                write(bos, element);
            }
        } else {
            throw new IllegalArgumentException("Cannot encode " + msg);
        }
    }

    private static void writeBulk(ByteArrayOutputStream bos, String s) {
        Objects.requireNonNull(s, "bulk string value");
        byte[] payload = stripLineBreaks(s).getBytes(StandardCharsets.UTF_8);
        writeHeader(bos, BULK_STRING, payload.length);
        bos.writeBytes(payload);
        bos.writeBytes(CRLF);
    }

    private static void writeHeader(ByteArrayOutputStream bos, char type, int count) {
        bos.write(type);
        bos.writeBytes(Integer.toString(count).getBytes(StandardCharsets.US_ASCII));
        bos.writeBytes(CRLF);
    }

    private static byte[] line(char type, String text) {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[body.length + 3];
        out[0] = (byte) type;
        System.arraycopy(body, 0, out, 1, body.length);
        out[out.length - 2] = '\r';
        out[out.length - 1] = '\n';
        return out;
    }
}
