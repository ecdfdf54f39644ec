package com.linlay.agentgateway.service;

import com.linlay.agentgateway.config.UploadProperties;
import com.linlay.agentgateway.model.BinaryPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Content-type whitelist and size cap for uploaded documents. Bytes are never altered.
 */
@Component
public class UploadValidator {

    private static final Logger log = LoggerFactory.getLogger(UploadValidator.class);

    static final String UNSUPPORTED_TYPE_MESSAGE = "Invalid file type. Only PDF, PNG and JPEG files are allowed";
    static final String EMPTY_FILE_MESSAGE = "File is empty";

    private final long maxSizeBytes;
    private final Set<String> allowedTypes;

    public UploadValidator(UploadProperties properties) {
        this.maxSizeBytes = properties.getMaxSizeBytes();
        this.allowedTypes = normalizeTypes(properties.getAllowedTypes());
        if (maxSizeBytes <= 0 || maxSizeBytes > Integer.MAX_VALUE) {
            throw new IllegalStateException("agent.upload.max-size-bytes must be between 1 and " + Integer.MAX_VALUE);
        }
        if (allowedTypes.isEmpty()) {
            throw new IllegalStateException("agent.upload.allowed-types cannot be empty");
        }
    }

    /**
     * Reads the part into memory, failing as soon as the size cap is crossed.
     */
    public Mono<BinaryPayload> read(FilePart part) {
        if (part == null) {
            return Mono.error(GatewayException.invalidInput("File is required"));
        }
        String filename = StringUtils.hasText(part.filename()) ? part.filename() : "unknown";
        String mimeType;
        try {
            mimeType = checkMediaType(part.headers().getFirst(HttpHeaders.CONTENT_TYPE));
        } catch (GatewayException ex) {
            log.info("Rejected upload filename={}, reason=unsupported-type, contentType={}",
                    filename, part.headers().getFirst(HttpHeaders.CONTENT_TYPE));
            return Mono.error(ex);
        }

        return DataBufferUtils.join(part.content(), (int) maxSizeBytes)
                .onErrorMap(DataBufferLimitException.class, ex -> {
                    log.info("Rejected upload filename={}, reason=too-large, limitBytes={}", filename, maxSizeBytes);
                    return tooLarge();
                })
                .map(buffer -> {
                    try {
                        byte[] bytes = new byte[buffer.readableByteCount()];
                        buffer.read(bytes);
                        return bytes;
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> check(filename, mimeType, bytes));
    }

    /**
     * Validates an already buffered candidate.
     */
    public BinaryPayload check(String filename, String mimeType, byte[] bytes) {
        String resolvedType = checkMediaType(mimeType);
        long size = bytes == null ? 0 : bytes.length;
        if (size > maxSizeBytes) {
            throw tooLarge();
        }
        if (size == 0) {
            throw GatewayException.invalidInput(EMPTY_FILE_MESSAGE);
        }
        return new BinaryPayload(filename, resolvedType, size, bytes);
    }

    public GatewayException tooLarge() {
        return new GatewayException(ErrorKind.PAYLOAD_TOO_LARGE, tooLargeMessage(maxSizeBytes));
    }

    static String tooLargeMessage(long maxSizeBytes) {
        return "File too large. Maximum size is " + (maxSizeBytes / (1024 * 1024)) + "MB";
    }

    private String checkMediaType(String rawContentType) {
        if (!StringUtils.hasText(rawContentType)) {
            throw new GatewayException(ErrorKind.UNSUPPORTED_MEDIA_TYPE, UNSUPPORTED_TYPE_MESSAGE);
        }
        // parameters such as charset are irrelevant for binary documents and may not parse
        int parametersStart = rawContentType.indexOf(';');
        String essence = parametersStart < 0 ? rawContentType : rawContentType.substring(0, parametersStart);
        MediaType contentType;
        try {
            contentType = MediaType.parseMediaType(essence.trim());
        } catch (InvalidMediaTypeException ex) {
            throw new GatewayException(ErrorKind.UNSUPPORTED_MEDIA_TYPE, UNSUPPORTED_TYPE_MESSAGE);
        }
        String type = (contentType.getType() + "/" + contentType.getSubtype()).toLowerCase(Locale.ROOT);
        if (!allowedTypes.contains(type)) {
            throw new GatewayException(ErrorKind.UNSUPPORTED_MEDIA_TYPE, UNSUPPORTED_TYPE_MESSAGE);
        }
        return "image/jpg".equals(type) ? MediaType.IMAGE_JPEG_VALUE : type;
    }

    private static Set<String> normalizeTypes(List<String> types) {
        if (types == null) {
            return Set.of();
        }
        return types.stream()
                .filter(StringUtils::hasText)
                .map(type -> type.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
