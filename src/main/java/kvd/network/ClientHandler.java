package kvd.network;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;
import kvd.protocol.ErrorValue;
import kvd.protocol.ProtocolException;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;
import kvd.utils.Log;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves one connection. Requests are answered strictly in arrival order: the response
 * to one request is written and flushed before the next request is dispatched.
 *
 * <p>All state is confined to the channel's event loop.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    // stop reading from a client that pipelines faster than it is served
    static final int MAX_PENDING_REQUESTS = 1024;

    private final CommandDispatcher dispatcher;
    private final AtomicInteger activeConnections;

    private final Deque<RespRequest> pending = new ArrayDeque<>();
    private boolean busy = false;
    // set once the stream is unreadable; queued requests are still answered before closing
    private ProtocolException closingError;

    public ClientHandler(CommandDispatcher dispatcher, AtomicInteger activeConnections) {
        this.dispatcher = dispatcher;
        this.activeConnections = activeConnections;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        activeConnections.incrementAndGet();
        Log.debug("Accepted connection from " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        activeConnections.decrementAndGet();
        pending.clear();
        Log.debug("Connection closed: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof RespRequest)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        pending.add((RespRequest) msg);
        if (pending.size() >= MAX_PENDING_REQUESTS) {
            ctx.channel().config().setAutoRead(false);
        }
        if (!busy) {
            processNext(ctx);
        }
    }

    private void processNext(ChannelHandlerContext ctx) {
        RespRequest request = pending.poll();
        if (request == null) {
            busy = false;
            if (closingError != null) {
                closeWithError(ctx, closingError);
            }
            return;
        }
        busy = true;
        if (closingError == null && !ctx.channel().config().isAutoRead()
                && pending.size() < MAX_PENDING_REQUESTS / 2) {
            ctx.channel().config().setAutoRead(true);
        }
        dispatcher.dispatch(request, ctx.executor())
                .whenComplete((response, error) -> {
                    // dispatch never fails, but a bug there must not stall the connection
                    RespValue reply = error == null ? response : ErrorValue.of("ERR internal error: " + error);
                    if (ctx.executor().inEventLoop()) {
                        respond(ctx, reply);
                    } else {
                        ctx.executor().execute(() -> respond(ctx, reply));
                    }
                });
    }

    private void respond(ChannelHandlerContext ctx, RespValue reply) {
        if (!ctx.channel().isActive()) {
            pending.clear();
            busy = false;
            return;
        }
        ctx.writeAndFlush(reply).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                processNext(ctx);
            } else {
                Log.warn("Error writing response to " + ctx.channel().remoteAddress() + ": " + f.cause());
                busy = false;
                ctx.close();
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ProtocolException protocolError = findProtocolError(cause);
        if (protocolError != null) {
            Log.warn("Protocol error from " + ctx.channel().remoteAddress() + ": " + protocolError.getMessage());
            if (closingError != null) {
                return;
            }
            closingError = protocolError;
            ctx.channel().config().setAutoRead(false);
            if (!busy) {
                closeWithError(ctx, protocolError);
            }
            return;
        }
        if (cause instanceof IOException) {
            Log.debug("Transport error on " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
        } else {
            Log.error("Unexpected error on " + ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private void closeWithError(ChannelHandlerContext ctx, ProtocolException error) {
        if (ctx.channel().isActive()) {
            ctx.writeAndFlush(ErrorValue.of("ERR Protocol error: " + error.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.close();
        }
    }

    private static ProtocolException findProtocolError(Throwable cause) {
        Throwable t = cause;
        while (t != null) {
            if (t instanceof ProtocolException) return (ProtocolException) t;
            if (!(t instanceof DecoderException)) return null;
            t = t.getCause();
        }
        return null;
    }
}
