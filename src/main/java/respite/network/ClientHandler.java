package respite.network;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import respite.commands.CommandDispatcher;
import respite.protocol.ProtocolViolationException;
import respite.protocol.Resp;
import respite.protocol.RespMessage;
import respite.utils.Log;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One per connection. Netty hands over decoded messages in arrival order;
 * each is dispatched and its reply flushed before the next one is read, so
 * pipelined commands are answered in order.
 *
 * <p>Unknown commands and arity failures are not answered unless
 * {@code replyErrors} is set. A protocol violation closes the connection.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {

    public enum State {
        AWAITING_COMMAND,
        DISPATCHING,
        REPLYING,
        CLOSED
    }

    private final CommandDispatcher dispatcher;
    private final boolean replyErrors;
    private ChannelHandlerContext ctx;
    private volatile State state = State.AWAITING_COMMAND;
    private long commandsProcessed = 0;

    public ClientHandler(CommandDispatcher dispatcher, boolean replyErrors) {
        this.dispatcher = dispatcher;
        this.replyErrors = replyErrors;
    }

    public State getState() {
        return state;
    }

    public long getCommandsProcessed() {
        return commandsProcessed;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        Log.debug("Client connected: " + getRemoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        state = State.CLOSED;
        Log.debug("Client disconnected: " + getRemoteAddress() + " after " + commandsProcessed + " commands");
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof RespMessage)) {
            ctx.fireChannelRead(msg);
            return;
        }
        if (this.ctx == null) this.ctx = ctx;

        state = State.DISPATCHING;
        try {
            dispatcher.dispatch(this, (RespMessage) msg);
            commandsProcessed++;
        } finally {
            if (state != State.CLOSED) {
                state = State.AWAITING_COMMAND;
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause;
        if (cause instanceof DecoderException && cause.getCause() != null) {
            root = cause.getCause();
        }

        if (root instanceof ProtocolViolationException) {
            Log.warn("Protocol error from " + getRemoteAddress(ctx) + ": " + root.getMessage());
            if (replyErrors && ctx.channel().isActive()) {
                state = State.CLOSED;
                ctx.writeAndFlush(Resp.error("ERR Protocol error: " + root.getMessage()))
                   .addListener(ChannelFutureListener.CLOSE);
                return;
            }
        } else {
            Log.error("Closing " + getRemoteAddress(ctx) + " after unexpected error", cause);
        }
        state = State.CLOSED;
        ctx.close();
    }

    protected void send(Object reply) {
        state = State.REPLYING;
        if (ctx != null) {
            ctx.writeAndFlush(reply);
        }
    }

    public void sendSimpleString(String msg) {
        send(RespMessage.simple(msg));
    }

    public void sendBulkString(String s) {
        send(RespMessage.bulk(Objects.requireNonNull(s, "bulk string value")));
    }

    public void sendNull() {
        send(RespMessage.nullBulk());
    }

    public void sendArray(List<String> list) {
        send(RespMessage.bulkArray(list));
    }

    public void sendError(String msg) {
        send(Resp.error(msg));
    }

    /** Too few arguments for {@code command}. */
    public void sendArityError(String command) {
        if (replyErrors) {
            sendError("ERR wrong number of arguments for '" + command.toLowerCase(Locale.ROOT) + "' command");
        } else {
            Log.debug("Dropping " + command + " from " + getRemoteAddress() + ": wrong number of arguments");
        }
    }

    public void sendUnknownCommand(String command) {
        if (replyErrors) {
            sendError("ERR unknown command '" + command + "'");
        } else {
            Log.debug("Ignoring unknown command '" + command + "' from " + getRemoteAddress());
        }
    }

    public String getRemoteAddress() {
        return getRemoteAddress(ctx);
    }

    private static String getRemoteAddress(ChannelHandlerContext ctx) {
        if (ctx != null && ctx.channel().remoteAddress() != null) {
            return ctx.channel().remoteAddress().toString();
        }
        return "0.0.0.0:0";
    }
}
