/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.report;

import ai.evacortex.specproof.core.compliance.ReferenceValidationResult;
import ai.evacortex.specproof.core.exceptions.SpecProofException;
import ai.evacortex.specproof.core.model.VerificationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Serializes verification and compliance reports as pretty-printed JSON.
 */
public final class ReportWriter {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    public String toJson(VerificationReport report) {
        return serialize(report);
    }

    public String toJson(ReferenceValidationResult result) {
        return serialize(result);
    }

    public void write(VerificationReport report, Path target) {
        writeTo(report, target);
    }

    public void write(ReferenceValidationResult result, Path target) {
        writeTo(result, target);
    }

    private String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SpecProofException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private void writeTo(Object value, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(target,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writeValue(out, value);
            }
        } catch (IOException e) {
            throw new SpecProofException("Failed to write report to " + target, e);
        }
    }
}
