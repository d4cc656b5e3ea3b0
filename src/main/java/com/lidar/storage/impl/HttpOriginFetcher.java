package com.lidar.storage.impl;

import com.lidar.storage.OriginFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;

/**
 * Streams http(s) locators to disk and copies local ones
 */
@Slf4j
@Component
public class HttpOriginFetcher implements OriginFetcher {

    private final HttpClient httpClient;

    public HttpOriginFetcher(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public long fetch(String locator, Path target, Duration timeout) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        String lower = locator.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return download(locator, target, timeout);
        }
        Path source = lower.startsWith("file:") ? Path.of(URI.create(locator)) : Path.of(locator);
        if (!Files.isRegularFile(source)) {
            throw new FileNotFoundException("Source not found: " + locator);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        return Files.size(target);
    }

    private long download(String url, Path target, Duration timeout) throws IOException {
        log.info("Downloading {}", url);
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<Path> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Files.deleteIfExists(target);
            throw new InterruptedIOException("Interrupted while downloading " + url);
        } catch (IOException e) {
            Files.deleteIfExists(target);
            throw e;
        }

        if (response.statusCode() / 100 != 2) {
            Files.deleteIfExists(target);
            throw new IOException("Download of " + url + " failed with HTTP " + response.statusCode());
        }
        long size = Files.size(target);
        log.info("Downloaded {} ({} bytes)", url, size);
        return size;
    }
}
