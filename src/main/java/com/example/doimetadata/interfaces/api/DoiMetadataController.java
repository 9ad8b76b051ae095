package com.example.doimetadata.interfaces.api;

import com.example.doimetadata.application.service.DoiMetadataService;
import com.example.doimetadata.domain.model.SourceRecord;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Interfaces-layer REST controller that runs the DOI metadata pipeline on a posted dataset record.
 */
@RestController
@RequestMapping(value = "/api/doi", produces = MediaType.APPLICATION_JSON_VALUE)
public class DoiMetadataController {

    private final DoiMetadataService doiMetadataService;

    /**
     * Creates the controller with the pipeline service.
     *
     * @param doiMetadataService service that builds the metadata and the registration document
     */
    public DoiMetadataController(DoiMetadataService doiMetadataService) {
        this.doiMetadataService = doiMetadataService;
    }

    /**
     * Returns the validated internal metadata record together with the tolerated optional-field errors.
     *
     * @param dataset dataset record as a JSON object
     * @return metadata preview
     */
    @PostMapping(value = "/metadata", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MetadataPreviewResponse> buildMetadata(@RequestBody Map<String, Object> dataset) {
        return ResponseEntity.ok(MetadataPreviewResponse.from(doiMetadataService.buildMetadata(new SourceRecord(dataset))));
    }

    /**
     * Returns the document ready to be serialized for the registration service.
     *
     * @param dataset dataset record as a JSON object
     * @return registration document
     */
    @PostMapping(value = "/document", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> buildDocument(@RequestBody Map<String, Object> dataset) {
        return ResponseEntity.ok(doiMetadataService.build(new SourceRecord(dataset)).asMap());
    }
}
