package respite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import respite.protocol.ProtocolViolationException;
import respite.protocol.RespMessage;
import respite.protocol.RespParser;

import java.util.List;

/**
 * Netty decoder for RESP. Emits one {@link RespMessage} per complete message
 * and keeps partial state in its own {@link RespParser}, so one instance
 * serves exactly one channel.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final RespParser parser = new RespParser();

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        RespMessage msg;
        try {
            msg = parser.parse(in);
        } catch (ProtocolViolationException e) {
            // Nothing after a violation can be framed reliably.
            parser.reset();
            in.skipBytes(in.readableBytes());
            throw e;
        }
        if (msg != null) {
            out.add(msg);
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (in.isReadable()) {
            decode(ctx, in, out);
        }
        if (in.isReadable() || parser.isMidMessage()) {
            int pending = in.readableBytes();
            in.skipBytes(pending);
            parser.reset();
            throw new ProtocolViolationException("unexpected end of stream inside a message with " + pending + " unread bytes");
        }
    }
}
