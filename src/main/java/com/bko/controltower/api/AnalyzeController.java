package com.bko.controltower.api;

import com.bko.controltower.orchestration.WorkflowLauncher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

@RestController
@RequestMapping("/api/analyze")
@Slf4j
public class AnalyzeController {

    private final WorkflowLauncher workflowLauncher;

    public AnalyzeController(WorkflowLauncher workflowLauncher) {
        this.workflowLauncher = workflowLauncher;
    }

    @PostMapping
    public AnalyzeResponse analyze(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded file is empty.");
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException ex) {
            log.warn("Could not read upload '{}'.", file.getOriginalFilename(), ex);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Could not read uploaded file.", ex);
        }
        workflowLauncher.launch(bytes);
        return AnalyzeResponse.processing();
    }
}
