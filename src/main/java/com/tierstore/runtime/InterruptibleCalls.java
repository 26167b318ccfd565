package com.tierstore.runtime;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Response;

/**
 * Runs an OkHttp call so that interrupting the waiting thread cancels the call.
 */
public final class InterruptibleCalls {
    private InterruptibleCalls() {
    }

    public static Response execute(Call call) throws IOException {
        CompletableFuture<Response> future = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completed, Response response) {
                if (!future.complete(response)) {
                    response.close();
                }
            }
        });
        try {
            return future.get();
        } catch (InterruptedException e) {
            call.cancel();
            future.cancel(false);
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("HTTP call to " + call.request().url() + " cancelled");
            cancellation.initCause(e);
            throw cancellation;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("HTTP call to " + call.request().url() + " failed", e.getCause());
        }
    }
}
