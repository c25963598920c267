package com.resumeai.interfaces.api.rewrite;

import com.resumeai.application.rewrite.RewriteAppService;
import com.resumeai.domain.rewrite.model.RewriteOutput;
import com.resumeai.domain.rewrite.model.RewriteRequest;
import com.resumeai.domain.rewrite.model.RewriteResult;
import com.resumeai.interfaces.api.dto.AnalyzeRequest;
import com.resumeai.interfaces.api.dto.AnalyzeResponse;
import com.resumeai.interfaces.api.dto.ParallelRewriteRequest;
import com.resumeai.interfaces.api.dto.ParallelRewriteResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rewrite")
@RequiredArgsConstructor
public class RewriteController {

    private final RewriteAppService rewriteAppService;

    /**
     * Bullet, summary or section rewrite, selected by the {@code type} field of the body.
     */
    @PostMapping
    public ResponseEntity<RewriteOutput> rewrite(@Valid @RequestBody RewriteRequest request) {
        return ResponseEntity.ok(rewriteAppService.rewrite(request));
    }

    @PostMapping("/bullets")
    public ResponseEntity<ParallelRewriteResponse> rewriteBullets(@Valid @RequestBody ParallelRewriteRequest request) {
        List<RewriteResult> results = rewriteAppService.rewriteBulletsParallel(
                request.bullets(), request.layer1(), request.targetRole());
        return ResponseEntity.ok(ParallelRewriteResponse.of(results));
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        return ResponseEntity.ok(AnalyzeResponse.from(rewriteAppService.analyze(request.text())));
    }
}
