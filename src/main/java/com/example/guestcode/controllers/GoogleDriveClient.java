package com.example.guestcode.controllers;

import com.example.guestcode.service.GoogleTokenStore;
import com.example.guestcode.service.exception.BookingSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleDriveClient {

    private final WebClient googleWebClient;
    private final GoogleTokenStore tokenStore;

    @Value("${google.drive.download-url}")
    private String downloadUrl;

    @Value("${http.timeout-seconds}")
    private long timeoutSeconds;

    /** Raw content of a Drive file. */
    public byte[] download(String fileId) {
        String accessToken = tokenStore.accessToken();
        byte[] content;
        try {
            content = googleWebClient.get()
                    .uri(downloadUrl, fileId)
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(Duration.ofSeconds(timeoutSeconds));
        } catch (WebClientResponseException e) {
            if (e.getCause() instanceof DataBufferLimitException limit) {
                throw tooLarge(fileId, limit);
            }
            log.error("Drive download of {} failed: {} : {}", fileId, e.getStatusCode(), e.getResponseBodyAsString());
            throw new BookingSourceException("Download of file " + fileId + " failed with status " + e.getStatusCode(), e);
        } catch (WebClientException e) {
            log.error("Drive download of {} failed: {}", fileId, e.getMessage());
            throw new BookingSourceException("Download of file " + fileId + " failed: " + e.getMessage(), e);
        } catch (DataBufferLimitException e) {
            throw tooLarge(fileId, e);
        } catch (IllegalStateException e) {
            throw new BookingSourceException("Download of file " + fileId + " timed out after " + timeoutSeconds + " s", e);
        }

        if (content == null || content.length == 0) {
            throw new BookingSourceException("File " + fileId + " is empty");
        }
        log.debug("Downloaded {} bytes of file {}", content.length, fileId);
        return content;
    }

    private static BookingSourceException tooLarge(String fileId, DataBufferLimitException e) {
        log.error("Drive file {} exceeds the download buffer: {}", fileId, e.getMessage());
        return new BookingSourceException("File " + fileId + " is larger than the download buffer allows", e);
    }
}
