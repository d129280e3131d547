package com.codeops.qr.controller;

import com.codeops.qr.config.AppConstants;
import com.codeops.qr.dto.response.QrCodeBase64Response;
import com.codeops.qr.model.QrRequest;
import com.codeops.qr.model.RenderedQrCode;
import com.codeops.qr.model.enums.OutputEncoding;
import com.codeops.qr.security.SecurityUtils;
import com.codeops.qr.service.QrCodeService;
import com.codeops.qr.service.QrRequestValidator;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;

/**
 * REST controller for QR code generation. Requires a bearer token carrying the
 * {@code qr:generate} scope.
 *
 * <p>The body is taken raw so that {@link QrRequestValidator} can report the first
 * violated field in a fixed order. The response is either the document itself with a
 * matching {@code Content-Type}, or a JSON envelope holding it in base64.</p>
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX)
@PreAuthorize("hasAuthority('SCOPE_" + AppConstants.SCOPE_QR_GENERATE + "')")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "QR Code Generation", description = "Render QR codes as PNG, JPEG, SVG, or PDF")
public class QrCodeController {

    static final String GENERATION_TIME_HEADER = "X-Generation-Time-Ms";
    static final String SIZE_HEADER = "X-QR-Size";
    static final String ERROR_CORRECTION_HEADER = "X-Error-Correction";
    static final String OUTPUT_FORMAT_HEADER = "X-Output-Format";

    private final QrRequestValidator qrRequestValidator;
    private final QrCodeService qrCodeService;

    /**
     * Generates a QR code.
     *
     * @param body the raw JSON request body
     * @return the rendered document, or its base64 envelope
     */
    @PostMapping(value = "/qr-code", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> generate(@RequestBody(required = false) String body) {
        QrRequest request = qrRequestValidator.validate(body);
        log.info("Generating {} QR code ({}, level {}) for '{}'", request.format().value(),
                request.size().value(), request.errorCorrection().value(),
                SecurityUtils.getCurrentSubject().username());

        RenderedQrCode rendered = qrCodeService.generate(request);
        HttpHeaders headers = new HttpHeaders();
        headers.set(GENERATION_TIME_HEADER, String.valueOf(rendered.generationTimeMs()));
        headers.set(SIZE_HEADER, request.size().value());
        headers.set(ERROR_CORRECTION_HEADER, request.errorCorrection().value());
        headers.set(OUTPUT_FORMAT_HEADER, request.encoding().value());

        if (request.encoding() == OutputEncoding.BASE64) {
            QrCodeBase64Response envelope = new QrCodeBase64Response(
                    Base64.getEncoder().encodeToString(rendered.content()),
                    request.format().value(),
                    OutputEncoding.BASE64.value(),
                    request.size().value(),
                    request.errorCorrection().value());
            return ResponseEntity.ok()
                    .headers(headers)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(envelope);
        }

        headers.setContentDisposition(ContentDisposition.inline()
                .filename("qr-code." + request.format().fileExtension())
                .build());
        return ResponseEntity.ok()
                .headers(headers)
                .contentType(MediaType.parseMediaType(request.format().contentType()))
                .body(rendered.content());
    }
}
