package me.golemcore.research.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.adapter.inbound.web.dto.ResearchRunDto;
import me.golemcore.research.adapter.inbound.web.dto.StartResearchRequest;
import me.golemcore.research.domain.model.Citation;
import me.golemcore.research.domain.model.Claim;
import me.golemcore.research.domain.model.ResearchMode;
import me.golemcore.research.domain.model.ResearchRequest;
import me.golemcore.research.domain.model.ResearchResult;
import me.golemcore.research.domain.model.ResearchRun;
import me.golemcore.research.domain.service.ResearchRunCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;

/**
 * Research run endpoints: start a run, poll its status and report, cancel it.
 */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    private final ResearchRunCoordinator coordinator;

    @PostMapping
    public Mono<ResponseEntity<ResearchRunDto>> start(@RequestBody StartResearchRequest body) {
        if (body == null || body.getQuery() == null || body.getQuery().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        ResearchRequest request = ResearchRequest.builder()
                .query(body.getQuery().trim())
                .mode(ResearchMode.fromString(body.getMode()))
                .maxSteps(body.getMaxSteps())
                .persist(!Boolean.FALSE.equals(body.getPersist()))
                .build();
        ResearchRun run = coordinator.start(request);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(toDto(run)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ResearchRunDto>> get(@PathVariable String id) {
        return coordinator.get(id)
                .map(run -> Mono.just(ResponseEntity.ok(toDto(run))))
                .orElse(Mono.just(ResponseEntity.notFound().build()));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<ResearchRunDto>> cancel(@PathVariable String id) {
        ResearchRun run = coordinator.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
        if (!coordinator.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Run already finished: " + id);
        }
        return Mono.just(ResponseEntity.accepted().body(toDto(run)));
    }

    @GetMapping("/modes")
    public Mono<ResponseEntity<List<ModeDto>>> modes() {
        List<ModeDto> modes = Arrays.stream(ResearchMode.values())
                .map(mode -> new ModeDto(mode.fileStem(), mode.getReportTitle(), mode.getToolNames()))
                .toList();
        return Mono.just(ResponseEntity.ok(modes));
    }

    static ResearchRunDto toDto(ResearchRun run) {
        ResearchRunDto.ResearchRunDtoBuilder dto = ResearchRunDto.builder()
                .id(run.getId())
                .query(run.getRequest().getQuery())
                .mode(run.getRequest().getMode().fileStem())
                .status(run.getStatus().name())
                .error(run.getError())
                .startedAt(run.getStartedAt().toString())
                .finishedAt(run.getFinishedAt() != null ? run.getFinishedAt().toString() : null);

        ResearchResult result = run.getResult();
        if (result != null) {
            dto.stopReason(result.getStopReason().name())
                    .steps(result.getSteps())
                    .report(result.getReport().body())
                    .reportFallback(result.getReport().fallback())
                    .reportPath(result.getReportPath() != null ? result.getReportPath().toString() : null)
                    .metrics(result.getMetrics())
                    .claims(result.getClaims().stream().map(ResearchController::toClaimDto).toList());
        }
        return dto.build();
    }

    private static ResearchRunDto.ClaimDto toClaimDto(Claim claim) {
        return ResearchRunDto.ClaimDto.builder()
                .text(claim.getText())
                .confidence(claim.getConfidence().name())
                .verdict(claim.getVerdict().name())
                .needsMoreResearch(claim.isNeedsMoreResearch())
                .supportingSources(claim.getSupportingEvidence().stream().map(Citation::sourceUrl).toList())
                .contradictingSources(claim.getContradictingEvidence().stream().map(Citation::sourceUrl).toList())
                .notes(claim.getNotes())
                .build();
    }

    record ModeDto(String name, String title, List<String> tools) {
    }
}
