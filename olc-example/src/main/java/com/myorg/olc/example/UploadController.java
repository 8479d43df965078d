package com.myorg.olc.example;

import com.myorg.olc.invoice.blob.BlobStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives files sent to the upload URLs handed out by {@code getImportUrl}.
 */
@RestController
@RequiredArgsConstructor
public class UploadController {

    private final BlobStore blobs;

    @PutMapping("/uploads/{*objectKey}")
    public ResponseEntity<Void> upload(@PathVariable String objectKey, @RequestBody byte[] content) {
        blobs.upload(objectKey.startsWith("/") ? objectKey.substring(1) : objectKey, content);
        return ResponseEntity.accepted().build();
    }
}
