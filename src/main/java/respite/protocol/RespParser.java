package respite.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Incremental RESP parser for one connection.
 *
 * <p>Each call to {@link #parse(ByteBuf)} consumes every complete field it can
 * and keeps the partially built message between calls, so bytes are scanned
 * once no matter how the input is chunked. It returns a message only once the
 * whole of it has arrived. Partial fields are never returned.
 */
public class RespParser {

    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    private static final int NO_BULK = -1;

    private static final class ArrayFrame {
        final int expected;
        final List<RespMessage> elements;

        ArrayFrame(int expected) {
            this.expected = expected;
            this.elements = new ArrayList<>(Math.min(expected, 16));
        }
    }

    private final Deque<ArrayFrame> frames = new ArrayDeque<>();
    private int bulkLength = NO_BULK;
    // Bytes of the pending line already searched for CR LF, counted from the reader index
    private int scanned;

    /**
     * Parses the next message from {@code in}.
     *
     * @return the message, or {@code null} when more input is needed
     */
    public RespMessage parse(ByteBuf in) throws ProtocolViolationException {
        while (true) {
            RespMessage field = bulkLength != NO_BULK ? readBulkPayload(in) : readLineField(in);
            if (field == null) return null;
            RespMessage done = complete(field);
            if (done != null) return done;
        }
    }

    /** Whether part of a message has been consumed without the message being finished. */
    public boolean isMidMessage() {
        return !frames.isEmpty() || bulkLength != NO_BULK;
    }

    public void reset() {
        frames.clear();
        bulkLength = NO_BULK;
        scanned = 0;
    }

    /**
     * Reads one line-framed field. Array headers are pushed as frames and
     * yield no field, which the caller sees as another loop iteration.
     */
    private RespMessage readLineField(ByteBuf in) throws ProtocolViolationException {
        while (true) {
            if (!in.isReadable()) return null;

            byte type = in.getByte(in.readerIndex());
            if (type != Resp.SIMPLE_STRING && type != Resp.BULK_STRING && type != Resp.ARRAY) {
                throw new ProtocolViolationException("unsupported type tag " + describe(type));
            }

            String line = readLine(in);
            if (line == null) return null;

            switch (type) {
                case Resp.SIMPLE_STRING:
                    return new RespMessage.SimpleString(trimControl(line));
                case Resp.BULK_STRING:
                    bulkLength = parseLength(line, "bulk string", MAX_BULK_LENGTH);
                    return readBulkPayload(in);
                default:
                    int count = parseLength(line, "array", MAX_ARRAY_LENGTH);
                    if (count == 0) {
                        return new RespMessage.Array(new ArrayList<>());
                    }
                    frames.push(new ArrayFrame(count));
                    break;
            }
        }
    }

    private RespMessage readBulkPayload(ByteBuf in) throws ProtocolViolationException {
        if (in.readableBytes() < bulkLength + 2) return null;

        String payload = in.readCharSequence(bulkLength, StandardCharsets.UTF_8).toString();
        bulkLength = NO_BULK;
        byte cr = in.readByte();
        byte lf = in.readByte();
        if (cr != '\r' || lf != '\n') {
            throw new ProtocolViolationException("bulk string terminator mismatch after payload '" + payload + "'");
        }
        return new RespMessage.BulkString(payload.strip());
    }

    /** Adds a finished field to the innermost open array; returns the top-level message once it closes. */
    private RespMessage complete(RespMessage field) {
        RespMessage current = field;
        while (!frames.isEmpty()) {
            ArrayFrame top = frames.peek();
            top.elements.add(current);
            if (top.elements.size() < top.expected) {
                return null;
            }
            frames.pop();
            current = new RespMessage.Array(top.elements);
        }
        return current;
    }

    private static int parseLength(String field, String what, int max) throws ProtocolViolationException {
        int length;
        try {
            length = Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new ProtocolViolationException("invalid " + what + " length '" + field + "'", e);
        }
        if (length < 0) {
            throw new ProtocolViolationException("negative " + what + " length " + length);
        }
        if (length > max) {
            throw new ProtocolViolationException(what + " length " + length + " exceeds limit " + max);
        }
        return length;
    }

    /**
     * Consumes the tag byte, the line and its CR LF, returning the text between
     * them, or {@code null} (consuming nothing) when no terminator has arrived.
     */
    private String readLine(ByteBuf in) throws ProtocolViolationException {
        int start = in.readerIndex();
        int last = in.writerIndex() - 1;
        int eol = -1;
        for (int i = start + Math.max(scanned, 1); i < last; i++) {
            if (in.getByte(i) == '\r' && in.getByte(i + 1) == '\n') {
                eol = i;
                break;
            }
        }
        if (eol < 0) {
            // A trailing CR may still be completed by the next chunk
            scanned = Math.max(scanned, last - start);
            if (scanned - 1 > MAX_LINE_LENGTH) {
                throw new ProtocolViolationException("line exceeds " + MAX_LINE_LENGTH + " bytes without CRLF");
            }
            return null;
        }
        scanned = 0;
        int length = eol - start - 1;
        if (length > MAX_LINE_LENGTH) {
            throw new ProtocolViolationException("line of " + length + " bytes exceeds " + MAX_LINE_LENGTH);
        }
        String line = in.toString(start + 1, length, StandardCharsets.UTF_8);
        in.readerIndex(eol + 2);
        return line;
    }

    private static String trimControl(String s) {
        int begin = 0;
        int end = s.length();
        while (begin < end && Character.isISOControl(s.charAt(begin))) begin++;
        while (end > begin && Character.isISOControl(s.charAt(end - 1))) end--;
        return s.substring(begin, end);
    }

    private static String describe(byte b) {
        if (b >= 0x20 && b < 0x7f) return "'" + (char) b + "'";
        return String.format("0x%02x", b & 0xff);
    }
}
