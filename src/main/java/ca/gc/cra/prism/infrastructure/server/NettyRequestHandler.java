package ca.gc.cra.prism.infrastructure.server;

import ca.gc.cra.prism.application.port.ImagingApplication;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.domain.http.HttpRequestMessage;
import ca.gc.cra.prism.domain.http.HttpResponseMessage;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts aggregated Netty requests to the {@link ImagingApplication} and writes its responses back.
 *
 * <p>Stateless; one instance is shared by every child channel.</p>
 */
@ChannelHandler.Sharable
final class NettyRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
  private static final Logger log = LoggerFactory.getLogger(NettyRequestHandler.class);

  private final ImagingApplication application;
  private final MetricsPort metrics;

  NettyRequestHandler(ImagingApplication application, MetricsPort metrics) {
    this.application = Objects.requireNonNull(application, "application");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    long started = System.nanoTime();
    metrics.increment("http.requests");

    HttpResponseMessage response;
    if (!request.decoderResult().isSuccess()) {
      response = HttpResponseMessage.text(400, "Bad Request");
    } else {
      Map<String, String> headers = new LinkedHashMap<>();
      for (Map.Entry<String, String> header : request.headers()) {
        headers.putIfAbsent(header.getKey(), header.getValue());
      }
      byte[] body = ByteBufUtil.getBytes(request.content());
      response = application.handle(
          new HttpRequestMessage(request.method().name(), request.uri(), headers, body));
    }

    byte[] payload = response.body();
    boolean head = HttpMethod.HEAD.equals(request.method());
    FullHttpResponse out = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        HttpResponseStatus.valueOf(response.status()),
        head ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(payload));
    out.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType());
    HttpUtil.setContentLength(out, payload.length);
    boolean keepAlive = HttpUtil.isKeepAlive(request);
    HttpUtil.setKeepAlive(out, keepAlive);

    metrics.increment("http.responses." + (response.status() / 100) + "xx");
    metrics.observe("http.latencyNanos", System.nanoTime() - started);
    ChannelFuture written = ctx.writeAndFlush(out);
    if (!keepAlive) {
      written.addListener(ChannelFutureListener.CLOSE);
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    log.warn("Closing connection from {} after failure", ctx.channel().remoteAddress(), cause);
    metrics.increment("http.connection.errors");
    ctx.close();
  }
}
