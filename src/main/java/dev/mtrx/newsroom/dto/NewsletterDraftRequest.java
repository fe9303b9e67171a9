package dev.mtrx.newsroom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsletterDraftRequest {
    private String title;
    private String subtitle;
    private String language;
    private Map<String, String> metadata;
}
