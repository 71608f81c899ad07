package ca.gc.cra.prism.infrastructure.server;

import ca.gc.cra.prism.application.port.HttpServerPort;
import ca.gc.cra.prism.application.port.ImagingApplication;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.server.ListeningSocket;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.unix.FileDescriptor;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Netty-based {@link HttpServerPort}.
 * <p><strong>Why:</strong> Sockets are acquired at bind time so address or descriptor problems surface
 * before the server starts; threads are created only by {@link #start(int)}.</p>
 * <p><strong>Transports:</strong> Address bindings use NIO. Adopted descriptors require the native epoll
 * transport (Linux).</p>
 * <p><strong>Thread-safety:</strong> Bind and start run on the bootstrap thread; {@link #stop()} is
 * synchronized and may run from a shutdown hook.</p>
 */
public final class NettyHttpServer implements HttpServerPort {
  private static final Logger log = LoggerFactory.getLogger(NettyHttpServer.class);
  private static final int BACKLOG = 128;
  private static final int MAX_CONTENT_LENGTH = 10 * 1024 * 1024;

  private final ImagingApplication application;
  private final MetricsPort metrics;
  private final List<PendingSocket> pending = new ArrayList<>();
  private final List<Channel> channels = new CopyOnWriteArrayList<>();
  private final List<EventLoopGroup> groups = new ArrayList<>();
  private Transport nio;
  private Transport epoll;
  private boolean started;
  private boolean stopped;

  public NettyHttpServer(ImagingApplication application, MetricsPort metrics) {
    this.application = Objects.requireNonNull(application, "application");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public synchronized void bind(int port, String address) throws IOException {
    requireOpen();
    ServerSocketChannel channel = ServerSocketChannel.open();
    try {
      channel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
      channel.bind(new InetSocketAddress(address, port), BACKLOG);
    } catch (IOException | RuntimeException ex) {
      closeQuietly(channel);
      throw new IOException("Unable to bind " + address + ":" + port, ex);
    }
    log.debug("Bound {}", channel.getLocalAddress());
    pending.add(new NioSocket(channel));
  }

  @Override
  public synchronized void addSocket(ListeningSocket socket) throws IOException {
    requireOpen();
    Objects.requireNonNull(socket, "socket");
    if (!Epoll.isAvailable()) {
      throw new IOException(
          "Native epoll transport is required to adopt descriptor " + socket.source(), Epoll.unavailabilityCause());
    }
    pending.add(new NativeSocket(socket));
  }

  @Override
  public synchronized void start(int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be at least 1 (was " + workers + ")");
    }
    requireOpen();
    if (pending.isEmpty()) {
      throw new IllegalStateException("No listening socket; call bind or addSocket first");
    }
    started = true;
    for (PendingSocket socket : List.copyOf(pending)) {
      ServerChannel channel;
      Transport transport;
      if (socket instanceof NioSocket nioSocket) {
        channel = new NioServerSocketChannel(nioSocket.channel());
        transport = nioTransport(workers);
      } else {
        channel = new EpollServerSocketChannel(((NativeSocket) socket).socket().fd());
        transport = epollTransport(workers);
      }
      io.netty.channel.ChannelFactory<ServerChannel> factory = () -> channel;
      ChannelFuture registered = new ServerBootstrap()
          .group(transport.acceptor(), transport.workers())
          .channelFactory(factory)
          .childHandler(new HttpInitializer(application, metrics))
          .register()
          .awaitUninterruptibly();
      if (!registered.isSuccess()) {
        stop();
        throw new IllegalStateException("Unable to start listening on " + socket, registered.cause());
      }
      pending.remove(socket);
      channels.add(registered.channel());
      log.info("PRISM listening on {}", registered.channel().localAddress());
    }
  }

  @Override
  public synchronized void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    for (Channel channel : channels) {
      channel.close().awaitUninterruptibly();
    }
    channels.clear();
    for (PendingSocket socket : pending) {
      socket.close();
    }
    pending.clear();
    for (EventLoopGroup group : groups) {
      group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }
    groups.clear();
    log.debug("HTTP server stopped");
  }

  /**
   * Returns the local addresses of the started listening channels.
   *
   * @return bound addresses; empty before {@link #start(int)}
   */
  public List<SocketAddress> boundAddresses() {
    List<SocketAddress> addresses = new ArrayList<>();
    for (Channel channel : channels) {
      addresses.add(channel.localAddress());
    }
    return addresses;
  }

  private Transport nioTransport(int workers) {
    if (nio == null) {
      nio = new Transport(
          new NioEventLoopGroup(1, ExecutorFactories.named("prism-acceptor", false, null)),
          new NioEventLoopGroup(workers, ExecutorFactories.named("prism-worker", false, null)));
      groups.add(nio.acceptor());
      groups.add(nio.workers());
    }
    return nio;
  }

  private Transport epollTransport(int workers) {
    if (epoll == null) {
      epoll = new Transport(
          new EpollEventLoopGroup(1, ExecutorFactories.named("prism-epoll-acceptor", false, null)),
          new EpollEventLoopGroup(workers, ExecutorFactories.named("prism-epoll-worker", false, null)));
      groups.add(epoll.acceptor());
      groups.add(epoll.workers());
    }
    return epoll;
  }

  private void requireOpen() {
    if (started || stopped) {
      throw new IllegalStateException("Server already " + (stopped ? "stopped" : "started"));
    }
  }

  private static void closeQuietly(ServerSocketChannel channel) {
    try {
      channel.close();
    } catch (IOException ex) {
      log.debug("Ignoring failure closing unbound channel", ex);
    }
  }

  private record Transport(EventLoopGroup acceptor, EventLoopGroup workers) {}

  private interface PendingSocket {
    void close();
  }

  private record NioSocket(ServerSocketChannel channel) implements PendingSocket {
    @Override
    public void close() {
      closeQuietly(channel);
    }
  }

  private record NativeSocket(ListeningSocket socket) implements PendingSocket {
    @Override
    public void close() {
      try {
        new FileDescriptor(socket.fd()).close();
      } catch (IOException ex) {
        log.warn("Unable to close adopted descriptor {}", socket.fd(), ex);
      }
    }
  }

  private static final class HttpInitializer extends ChannelInitializer<SocketChannel> {
    private final NettyRequestHandler handler;

    private HttpInitializer(ImagingApplication application, MetricsPort metrics) {
      this.handler = new NettyRequestHandler(application, metrics);
    }

    @Override
    protected void initChannel(SocketChannel channel) {
      channel.pipeline()
          .addLast("codec", new HttpServerCodec())
          .addLast("aggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH))
          .addLast("prism", handler);
    }
  }
}
