package com.example.chat.messaging.dto;

public record LanguageResponse(String id, String code, String name, String nativeName) {
}
