package com.goerdes.pdbdbi.api;

import com.goerdes.pdbdbi.exception.FileProcessingException;
import com.goerdes.pdbdbi.model.DbiSummary;
import com.goerdes.pdbdbi.model.DbiSummary.ModuleSummary;
import com.goerdes.pdbdbi.services.DbiAnalysisService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class DbiController {

    private final DbiAnalysisService dbiAnalysisService;

    /**
     * Decodes the DBI stream of the uploaded stream bundle.
     *
     * @param file ZIP archive with one entry per PDB stream
     * @return the summary of the DBI stream
     * @throws FileProcessingException if the bundle or its DBI stream is invalid
     */
    @PostMapping("/dbi")
    public ResponseEntity<DbiSummary> analyze(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(dbiAnalysisService.analyze(file));
    }

    /**
     * Lists the modules of the uploaded bundle, optionally only those compiled
     * from a matching source file.
     *
     * @param file   ZIP archive with one entry per PDB stream
     * @param source optional case-insensitive substring of a source file name
     * @return the matching modules
     */
    @PostMapping("/dbi/modules")
    public ResponseEntity<List<ModuleSummary>> modules(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "source", required = false) String source
    ) {
        return ResponseEntity.ok(dbiAnalysisService.modules(file, source));
    }

    @ExceptionHandler(FileProcessingException.class)
    public ResponseEntity<String> onError(FileProcessingException ex) {
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

}
