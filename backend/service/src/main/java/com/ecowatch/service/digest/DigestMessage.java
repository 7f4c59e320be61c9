package com.ecowatch.service.digest;

public record DigestMessage(String subject, String text) {
}
