package prism.coordinator.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.*;
import prism.coordinator.stream.EventSink;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Writes server-sent event frames to a Netty channel as a chunked response.
 * The response head is written with the first frame.
 */
public class ChannelEventSink implements EventSink {

    private final Channel channel;
    private final AtomicBoolean headWritten = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public ChannelEventSink(Channel channel) {
        this.channel = channel;
        channel.closeFuture().addListener(f -> closed.set(true));
    }

    @Override
    public boolean send(String frame) {
        if (!isOpen()) {
            return false;
        }
        if (headWritten.compareAndSet(false, true)) {
            channel.write(head());
        }
        channel.writeAndFlush(new DefaultHttpContent(
                Unpooled.copiedBuffer(frame, StandardCharsets.UTF_8)));
        return true;
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!channel.isActive()) {
            return;
        }
        if (headWritten.get()) {
            channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT)
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    static HttpResponse head() {
        HttpResponse response = new DefaultHttpResponse(HTTP_1_1, HttpResponseStatus.OK);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, "no-cache");
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        response.headers().set("X-Accel-Buffering", "no");
        HttpUtil.setTransferEncodingChunked(response, true);
        return response;
    }
}
