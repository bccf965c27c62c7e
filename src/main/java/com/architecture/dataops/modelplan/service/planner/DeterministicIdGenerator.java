package com.architecture.dataops.modelplan.service.planner;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Generates stable, content-derived identifiers for plans and plan steps.
 *
 * Ids are:
 * - Deterministic: the same model and refs always give the same id
 * - Opaque: 64 lowercase hex characters (SHA-256)
 * - Clock-free: no timestamps or random values feed into them
 *
 * Format Rules:
 * - Step: sha256("{model}:{base}:{target}")
 * - Plan: sha256(base, target, stepId_1 ... stepId_n) fed in order, without separators
 */
@Service
public class DeterministicIdGenerator {

    private static final HexFormat HEX = HexFormat.of();

    public String generateStepId(String modelName, String base, String target) {
        MessageDigest digest = newDigest();
        update(digest, modelName + ":" + base + ":" + target);
        return HEX.formatHex(digest.digest());
    }

    /**
     * @param stepIds step ids in plan order
     */
    public String generatePlanId(String base, String target, List<String> stepIds) {
        MessageDigest digest = newDigest();
        update(digest, base);
        update(digest, target);
        for (String stepId : stepIds) {
            update(digest, stepId);
        }
        return HEX.formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
