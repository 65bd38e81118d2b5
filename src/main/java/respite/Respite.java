package respite;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import respite.commands.CommandDispatcher;
import respite.commands.CommandRegistry;
import respite.db.KeyValueStore;
import respite.network.ClientHandler;
import respite.protocol.netty.NettyRespDecoder;
import respite.protocol.netty.NettyRespEncoder;
import respite.utils.Log;

import java.net.InetSocketAddress;

/**
 * Server entry point. Owns the store, the configuration and the Netty event
 * loops; every accepted channel gets its own decoder, encoder and
 * {@link ClientHandler}, all sharing one {@link CommandDispatcher}.
 */
public class Respite {
    public static final String VERSION = "0.1.0";

    private final Config config;
    private final KeyValueStore store;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public Respite(Config config) {
        this(config, new KeyValueStore());
    }

    public Respite(Config config, KeyValueStore store) {
        this.config = config;
        this.store = store;
        this.dispatcher = new CommandDispatcher(CommandRegistry.createDefault(store, config));
    }

    public KeyValueStore getStore() {
        return store;
    }

    /** Binds the listening socket. Returns once the server accepts connections. */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .option(ChannelOption.SO_REUSEADDR, true)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) {
                     ch.pipeline().addLast(new NettyRespDecoder());
                     ch.pipeline().addLast(new NettyRespEncoder());
                     ch.pipeline().addLast(new ClientHandler(dispatcher, config.isReplyErrors()));
                 }
             });

            serverChannel = b.bind(config.getBind(), config.getPort()).sync().channel();
        } catch (Exception e) {
            shutdown();
            throw e;
        }
        Log.info("Ready on " + config.getBind() + ":" + getPort());
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int getPort() {
        if (serverChannel == null) return config.getPort();
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void awaitClose() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public synchronized void shutdown() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
            workerGroup = null;
        }
    }

    public static void printBanner(Config config) {
        Log.info("\n" +
                " :: Respite ::      (v" + VERSION + ")\n" +
                " :: Port ::         " + config.getPort() + "\n" +
                " :: Dir ::          " + (config.getDir() == null ? "(unset)" : config.getDir()) + "\n" +
                " :: DB file ::      " + (config.getDbFileName() == null ? "(unset)" : config.getDbFileName()) + "\n");
    }

    public static void main(String[] args) throws Exception {
        Config config;
        try {
            config = Config.fromArgs(args);
        } catch (RuntimeException e) {
            Log.error("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        Log.setVerbose(config.isVerbose());
        printBanner(config);

        Respite server = new Respite(config);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.shutdown();
        }, "respite-shutdown"));

        server.awaitClose();
    }
}
