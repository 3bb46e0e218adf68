package com.openforge.invoicemate.email;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Downloads draft attachments from their issued links. A download that fails
 * is skipped and reported back to the caller; it never aborts the others.
 */
@Slf4j
public class AttachmentFetcher {

    public record FetchOutcome(List<FetchedAttachment> attachments, List<String> failures) {}

    private final HttpClient httpClient;
    private final Duration   timeout;
    private final long       maxBytes;

    public AttachmentFetcher(HttpClient httpClient, Duration timeout, long maxBytes) {
        this.httpClient = httpClient;
        this.timeout    = timeout;
        this.maxBytes   = maxBytes;
    }

    public FetchOutcome fetchAll(List<EmailAttachment> attachments) {
        List<FetchedAttachment> fetched = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (EmailAttachment attachment : attachments) {
            String name = attachment.filename() == null || attachment.filename().isBlank()
                    ? "attachment" : attachment.filename();
            try {
                fetched.add(fetch(attachment.url(), name));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("[Email] Skipping attachment {}: {}", name, e.getMessage());
                failures.add(name + " (" + e.getMessage() + ")");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(name + " (interrupted)");
                break;
            }
        }
        return new FetchOutcome(fetched, failures);
    }

    private FetchedAttachment fetch(String url, String filename) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("HTTP " + response.statusCode());
        }
        byte[] body = response.body();
        if (body.length > maxBytes) {
            throw new IOException("larger than " + maxBytes + " bytes");
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("application/octet-stream");
        log.debug("[Email] Downloaded attachment {} ({} bytes)", filename, body.length);
        return new FetchedAttachment(filename, contentType, body);
    }
}
