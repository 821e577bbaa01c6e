package com.example.directory.api;

import com.example.directory.service.DirectoryUploadService;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
public class DirectoryUploadController {

  private final DirectoryUploadService uploadService;

  @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<Void> upload(
      @RequestParam(value = "pass", required = false) String pass,
      @RequestPart("file") MultipartFile file)
      throws IOException {
    uploadService.replace(pass, file.getBytes());
    return ResponseEntity.noContent().build();
  }
}
