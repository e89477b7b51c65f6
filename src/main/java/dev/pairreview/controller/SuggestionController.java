package dev.pairreview.controller;

import dev.pairreview.dto.request.AdoptRequest;
import dev.pairreview.dto.request.StatusUpdateRequest;
import dev.pairreview.dto.response.CommentResponse;
import dev.pairreview.service.SuggestionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/suggestions")
public class SuggestionController {

    private static final String DEFAULT_AUTHOR = "Reviewer";

    private final SuggestionService suggestionService;

    public SuggestionController(SuggestionService suggestionService) {
        this.suggestionService = suggestionService;
    }

    @PostMapping("/{suggestionId}/adopt")
    public ResponseEntity<CommentResponse> adopt(@PathVariable long suggestionId,
                                                 @RequestBody(required = false) AdoptRequest request) {
        String body = request != null ? request.body() : null;
        String author = request != null && request.author() != null && !request.author().isBlank()
                ? request.author() : DEFAULT_AUTHOR;
        return ResponseEntity.status(HttpStatus.CREATED).body(suggestionService.adopt(suggestionId, body, author));
    }

    @PatchMapping("/{suggestionId}/status")
    public CommentResponse updateStatus(@PathVariable long suggestionId,
                                        @Valid @RequestBody StatusUpdateRequest request) {
        return suggestionService.updateStatus(suggestionId, request.status());
    }
}
