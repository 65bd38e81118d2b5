package respite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.EncoderException;
import io.netty.handler.codec.MessageToByteEncoder;
import respite.protocol.Resp;
import respite.protocol.RespMessage;

/**
 * Encodes reply values into RESP. {@link RespMessage}s go through
 * {@link Resp#encode}; {@code byte[]} is taken as already encoded.
 */
public class NettyRespEncoder extends MessageToByteEncoder<Object> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Object msg, ByteBuf out) throws Exception {
        if (msg instanceof RespMessage) {
            out.writeBytes(Resp.encode((RespMessage) msg));
        } else if (msg instanceof byte[]) {
            out.writeBytes((byte[]) msg);
        } else {
            throw new EncoderException("unsupported reply type " + msg.getClass().getName());
        }
    }
}
