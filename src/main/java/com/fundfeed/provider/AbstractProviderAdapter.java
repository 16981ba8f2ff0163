package com.fundfeed.provider;

import com.fundfeed.domain.model.FetchRequest;

/**
 * Splits a fetch into a retried network step and a single parse/normalize step.
 *
 * <p>Only {@link #fetchRaw} runs under the {@link RetryPolicy}, so a schema failure in
 * {@link #normalize} is reported once instead of re-downloading the same bad payload.
 * Adapters over paged endpoints retry page by page instead, see {@link #retriesEachCall()}.
 *
 * @param <R> raw payload type as returned by the vendor call
 * @param <T> normalized value type
 */
public abstract class AbstractProviderAdapter<R, T> implements ProviderAdapter<T> {

    protected final VendorHttpClient vendorHttpClient;
    private final RetryPolicy retryPolicy;

    protected AbstractProviderAdapter(VendorHttpClient vendorHttpClient, RetryPolicy retryPolicy) {
        this.vendorHttpClient = vendorHttpClient;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public final T fetch(FetchRequest request) {
        R raw = retriesEachCall()
                ? fetchRaw(request)
                : retryPolicy.execute(sourceName(), () -> fetchRaw(request));
        return normalize(raw, request);
    }

    /**
     * True when {@link #fetchRaw} issues several vendor calls and retries each one itself, as
     * paged endpoints do; the whole step is then not retried again.
     */
    protected boolean retriesEachCall() {
        return false;
    }

    protected abstract R fetchRaw(FetchRequest request);

    protected abstract T normalize(R raw, FetchRequest request);
}
