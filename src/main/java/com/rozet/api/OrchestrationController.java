package com.rozet.api;

import com.rozet.locking.FileLockManager;
import com.rozet.orchestration.OrchestratorService;
import com.rozet.orchestration.model.OrchestrationResult;
import com.rozet.orchestration.model.WorkerResult;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/orchestrator")
public class OrchestrationController {

    private final OrchestratorService orchestratorService;
    private final FileLockManager fileLockManager;

    public OrchestrationController(OrchestratorService orchestratorService, FileLockManager fileLockManager) {
        this.orchestratorService = orchestratorService;
        this.fileLockManager = fileLockManager;
    }

    @PostMapping("/plan")
    public PlanResponse plan(@Valid @RequestBody PlanRequest request) {
        return PlanResponse.from(orchestratorService.plan(request.request(), request.contextSummary()));
    }

    @PostMapping("/execute")
    public ExecutionResponse execute(@Valid @RequestBody ExecuteRequest request) {
        List<WorkerResult> results = orchestratorService.execute(request.tasks(), request.workingDir());
        return ExecutionResponse.from(new OrchestrationResult(request.tasks(), results));
    }

    @PostMapping("/run")
    public ExecutionResponse run(@Valid @RequestBody RunRequest request) {
        return ExecutionResponse.from(
                orchestratorService.run(request.request(), request.contextSummary(), request.workingDir()));
    }

    @GetMapping("/locks")
    public List<LockView> locks() {
        return fileLockManager.snapshot().stream().map(LockView::from).toList();
    }
}
