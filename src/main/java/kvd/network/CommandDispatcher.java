package kvd.network;

import kvd.KvdException;
import kvd.commands.Command;
import kvd.commands.CommandRegistry;
import kvd.context.RequestContext;
import kvd.context.TimedOutException;
import kvd.protocol.ErrorValue;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;
import kvd.utils.Log;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes requests to their command and runs them off the I/O threads.
 *
 * <p>Each request gets a fresh {@link RequestContext}. The handler is raced against the
 * context deadline: when the deadline wins, the reply is a timeout error and the handler
 * task is cancelled with an interrupt. Whatever the handler already wrote to the store
 * stays written.
 *
 * <p>The returned future always completes normally: failures are turned into
 * {@link ErrorValue}s here.
 */
public class CommandDispatcher implements AutoCloseable {
    private final CommandRegistry registry;
    private final ExecutorService executor;
    private final Duration timeout;
    private final int retries;
    private final AtomicLong totalCommands = new AtomicLong();

    public CommandDispatcher(CommandRegistry registry, Duration timeout, int retries, int threads) {
        this(registry, timeout, retries, Executors.newFixedThreadPool(threads, new CommandThreadFactory()));
    }

    public CommandDispatcher(CommandRegistry registry, Duration timeout, int retries, ExecutorService executor) {
        this.registry = registry;
        this.timeout = timeout;
        this.retries = retries;
        this.executor = executor;
    }

    public CompletableFuture<RespValue> dispatch(RespRequest request, ScheduledExecutorService timer) {
        totalCommands.incrementAndGet();
        RequestContext context = new RequestContext(timeout, retries);
        if (Log.isDebugEnabled()) {
            Log.debug("Dispatching " + request);
        }

        Command command;
        try {
            command = registry.getHandler(request.commandName().toUpperCase(Locale.ROOT));
        } catch (KvdException e) {
            return CompletableFuture.completedFuture(ErrorValue.of(e));
        }

        CompletableFuture<RespValue> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> result.complete(invoke(command, context, request)));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(ErrorValue.of("ERR server is shutting down"));
        }

        Duration deadline = context.getTimeout();
        if (deadline != null) {
            ScheduledFuture<?> timeoutTask = timer.schedule(() -> {
                if (result.complete(ErrorValue.of(new TimedOutException(deadline)))) {
                    task.cancel(true);
                    Log.warn("Request timed out after " + deadline.toMillis() + " ms: " + request);
                }
            }, deadline.toNanos(), TimeUnit.NANOSECONDS);
            result.whenComplete((v, e) -> timeoutTask.cancel(false));
        }
        return result;
    }

    private static RespValue invoke(Command command, RequestContext context, RespRequest request) {
        try {
            return command.execute(context, request);
        } catch (KvdException e) {
            return ErrorValue.of(e);
        } catch (Throwable t) {
            Log.error("Command failed: " + request, t);
            return ErrorValue.of("ERR internal error: " + t);
        }
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public long getTotalCommands() {
        return totalCommands.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class CommandThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "kvd-command-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
