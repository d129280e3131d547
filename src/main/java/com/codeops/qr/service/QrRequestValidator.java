package com.codeops.qr.service;

import com.codeops.qr.config.AppConstants;
import com.codeops.qr.config.QrProperties;
import com.codeops.qr.exception.CapacityExceededException;
import com.codeops.qr.exception.PayloadTooLargeException;
import com.codeops.qr.exception.ValidationException;
import com.codeops.qr.model.QrRequest;
import com.codeops.qr.model.enums.ErrorCorrection;
import com.codeops.qr.model.enums.OutputEncoding;
import com.codeops.qr.model.enums.OutputFormat;
import com.codeops.qr.model.enums.QrSize;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parses and validates the raw JSON body of a QR generation request.
 *
 * <p>Checks run in a fixed order and the first failure is reported:
 * body size, JSON shape, data presence, data length and URL form, size, format,
 * error correction, output encoding, and finally the byte capacity of the chosen
 * error correction level. Missing or null optional fields take their defaults;
 * unknown fields are ignored.</p>
 */
@Component
@RequiredArgsConstructor
public class QrRequestValidator {

    static final String FIELD_BODY = "body";
    static final String FIELD_DATA = "data";
    static final String FIELD_SIZE = "size";
    static final String FIELD_FORMAT = "format";
    static final String FIELD_ERROR_CORRECTION = "error_correction";
    static final String FIELD_OUTPUT_FORMAT = "output_format";

    static final String REQUIRED = "required";
    static final String JSON = "json";
    static final String TYPE = "type";
    static final String MIN_LENGTH = "min_length";
    static final String MAX_LENGTH = "max_length";
    static final String URL_FORMAT = "url_format";
    static final String ENUM = "enum";

    private static final Pattern URL_PATTERN = Pattern.compile(
            "^https?://"
                    + "(?:(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+[A-Z]{2,6}\\.?"
                    + "|localhost"
                    + "|\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})"
                    + "(?::\\d+)?"
                    + "(?:/?|[/?]\\S+)$",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;
    private final QrProperties qrProperties;

    /**
     * Validates a raw request body.
     *
     * @param rawBody the request body as received, may be null
     * @return the validated request with defaults applied
     * @throws PayloadTooLargeException   if the body exceeds the configured byte limit
     * @throws CapacityExceededException  if the data does not fit the error correction level
     * @throws ValidationException        for the first other violated constraint
     */
    public QrRequest validate(String rawBody) {
        if (rawBody != null && rawBody.getBytes(StandardCharsets.UTF_8).length > qrProperties.getMaxRequestBytes()) {
            throw new PayloadTooLargeException(qrProperties.getMaxRequestBytes());
        }
        JsonNode root = parse(rawBody);

        String data = validateData(root.get(FIELD_DATA));
        QrSize size = enumField(root, FIELD_SIZE, QrSize::fromValue, QrRequest.DEFAULT_SIZE,
                Arrays.stream(QrSize.values()).map(QrSize::value));
        OutputFormat format = enumField(root, FIELD_FORMAT, OutputFormat::fromValue, QrRequest.DEFAULT_FORMAT,
                Arrays.stream(OutputFormat.values()).map(OutputFormat::value));
        ErrorCorrection errorCorrection = enumField(root, FIELD_ERROR_CORRECTION, ErrorCorrection::fromValue,
                QrRequest.DEFAULT_ERROR_CORRECTION, Arrays.stream(ErrorCorrection.values()).map(ErrorCorrection::value));
        OutputEncoding encoding = enumField(root, FIELD_OUTPUT_FORMAT, OutputEncoding::fromValue,
                QrRequest.DEFAULT_ENCODING, Arrays.stream(OutputEncoding.values()).map(OutputEncoding::value));

        checkCapacity(data, errorCorrection);
        return new QrRequest(data, size, format, errorCorrection, encoding);
    }

    /**
     * Checks that the UTF-8 encoding of {@code data} fits the byte ceiling of a level.
     *
     * @param data            the data to encode
     * @param errorCorrection the chosen level
     * @throws CapacityExceededException if it does not fit
     */
    public void checkCapacity(String data, ErrorCorrection errorCorrection) {
        int bytes = data.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > errorCorrection.maxBytes()) {
            throw new CapacityExceededException(errorCorrection.value(), errorCorrection.maxBytes(), bytes);
        }
    }

    private JsonNode parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new ValidationException(FIELD_BODY, REQUIRED, "Request body is required");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new ValidationException(FIELD_BODY, JSON, "Malformed request body");
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(FIELD_BODY, JSON, "Request body must be a JSON object");
        }
        return root;
    }

    private String validateData(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new ValidationException(FIELD_DATA, REQUIRED, "Data is required");
        }
        if (!node.isTextual()) {
            throw new ValidationException(FIELD_DATA, TYPE, "Data must be a string");
        }
        String data = node.asText();
        if (data.isBlank()) {
            throw new ValidationException(FIELD_DATA, MIN_LENGTH, "Data cannot be empty");
        }
        if (data.codePointCount(0, data.length()) > AppConstants.MAX_DATA_LENGTH) {
            throw new ValidationException(FIELD_DATA, MAX_LENGTH,
                    "Data exceeds maximum length of " + AppConstants.MAX_DATA_LENGTH + " characters");
        }
        if (looksLikeUrl(data) && !URL_PATTERN.matcher(data).matches()) {
            throw new ValidationException(FIELD_DATA, URL_FORMAT, "Invalid URL format");
        }
        return data;
    }

    private static boolean looksLikeUrl(String data) {
        return data.startsWith("http://") || data.startsWith("https://") || data.startsWith("ftp://");
    }

    private static <E> E enumField(JsonNode root, String field, Function<String, Optional<E>> parser,
                                   E defaultValue, Stream<String> allowed) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        String value = node.isTextual() ? node.asText() : node.toString();
        Optional<E> parsed = node.isTextual() ? parser.apply(value) : Optional.empty();
        return parsed.orElseThrow(() -> new ValidationException(field, ENUM, String.format(
                "Invalid %s '%s'. Valid values: %s", field, value, allowed.collect(Collectors.joining(", ")))));
    }
}
