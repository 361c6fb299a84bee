package com.agripulse.backend.controller;

import com.agripulse.backend.service.InsightService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Crop leaf disease detection from an uploaded photo. Not cached.
 */
@Slf4j
@RestController
@RequestMapping("/detect")
@RequiredArgsConstructor
public class DetectController {

    private final InsightService insightService;

    // POST /detect (multipart, part "file")
    @PostMapping(value = {"", "/"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ObjectNode> detect(@RequestPart("file") FilePart file) {
        MediaType type = file.headers().getContentType();
        if (type == null || !"image".equalsIgnoreCase(type.getType()) || type.isWildcardSubtype()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded file is not a valid image"));
        }
        String mimeType = type.getType() + "/" + type.getSubtype();
        log.info("POST /detect file={} type={}", file.filename(), mimeType);

        return DataBufferUtils.join(file.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .filter(bytes -> bytes.length > 0)
                .switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded file is empty")))
                .flatMap(bytes -> insightService.diagnoseLeaf(mimeType, bytes))
                .map(diagnosis -> {
                    ObjectNode out = diagnosis.deepCopy();
                    out.put("filename", file.filename());
                    return out;
                })
                .onErrorMap(ex -> !(ex instanceof ResponseStatusException), ex -> {
                    log.error("❌ Gemini detection error", ex);
                    return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
                });
    }
}
