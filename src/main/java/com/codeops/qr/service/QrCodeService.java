package com.codeops.qr.service;

import com.codeops.qr.config.QrProperties;
import com.codeops.qr.exception.QrApiException;
import com.codeops.qr.exception.RenderFailureException;
import com.codeops.qr.exception.ServiceBusyException;
import com.codeops.qr.model.QrRequest;
import com.codeops.qr.model.RenderedQrCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Generates QR codes for validated requests on the bounded render pool, so a slow
 * render occupies a render worker rather than delaying token checks on other requests.
 * Failures are surfaced once; nothing is retried.
 */
@Service
@Slf4j
public class QrCodeService {

    private final QrRenderer qrRenderer;
    private final AsyncTaskExecutor renderExecutor;
    private final QrProperties qrProperties;

    public QrCodeService(QrRenderer qrRenderer,
                         @Qualifier("qrRenderExecutor") AsyncTaskExecutor renderExecutor,
                         QrProperties qrProperties) {
        this.qrRenderer = qrRenderer;
        this.renderExecutor = renderExecutor;
        this.qrProperties = qrProperties;
    }

    /**
     * Renders a QR code and measures how long it took.
     *
     * @param request the validated request
     * @return the rendered document with timing
     * @throws ServiceBusyException   if the render pool is saturated
     * @throws RenderFailureException if rendering fails or times out
     */
    public RenderedQrCode generate(QrRequest request) {
        long start = System.nanoTime();

        Future<byte[]> future;
        try {
            future = renderExecutor.submit(() -> qrRenderer.render(request));
        } catch (TaskRejectedException e) {
            throw new ServiceBusyException("QR render pool is saturated", e);
        }

        byte[] content = await(future);
        long generationTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        log.info("QR generated - data: {} chars, size: {}, format: {}, error correction: {}, time: {}ms",
                request.data().length(), request.size().value(), request.format().value(),
                request.errorCorrection().value(), generationTimeMs);
        return new RenderedQrCode(content, request, generationTimeMs);
    }

    private byte[] await(Future<byte[]> future) {
        try {
            return future.get(qrProperties.getRenderTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw RenderFailureException.unexpected("QR generation timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw RenderFailureException.unexpected("QR generation was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QrApiException apiException) {
                throw apiException;
            }
            throw RenderFailureException.unexpected("QR generation failed", cause);
        }
    }
}
