package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaAttachment {
    private String url;
    private String filename;
    private String mimeType;
    private Long sizeBytes;
    private String thumbnailUrl;
    private Integer width;
    private Integer height;
}
