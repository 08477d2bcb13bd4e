package com.bko.workouttracker.workout.web;

import com.bko.workouttracker.workout.BulkSheet;
import com.bko.workouttracker.workout.SessionOutcome;
import com.bko.workouttracker.workout.SessionView;
import com.bko.workouttracker.workout.SetInput;
import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.WorkoutSessionUseCase;
import com.bko.workouttracker.workout.history.ProgressReportService;
import com.bko.workouttracker.workout.web.dto.BulkEntryDto;
import com.bko.workouttracker.workout.web.dto.ProgressReportDto;
import com.bko.workouttracker.workout.web.dto.SetEntryDto;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class WorkoutSessionController {
    private final WorkoutSessionUseCase workoutSessionUseCase;
    private final ProgressReportService progressReportService;

    public WorkoutSessionController(WorkoutSessionUseCase workoutSessionUseCase, ProgressReportService progressReportService) {
        this.workoutSessionUseCase = workoutSessionUseCase;
        this.progressReportService = progressReportService;
    }

    @GetMapping(value = "/trainees/{traineeId}/trainings", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Training> trainings(@PathVariable String traineeId) throws IOException {
        return workoutSessionUseCase.listTrainings(traineeId);
    }

    @GetMapping(value = "/trainings/{trainingId}/session", produces = MediaType.APPLICATION_JSON_VALUE)
    public SessionView open(@PathVariable String trainingId) throws IOException {
        return workoutSessionUseCase.open(trainingId);
    }

    @PutMapping(value = "/trainings/{trainingId}/exercises/{exerciseId}/sets/{setIndex}",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SessionOutcome> recordSet(@PathVariable String trainingId,
                                                    @PathVariable String exerciseId,
                                                    @PathVariable int setIndex,
                                                    @RequestBody SetEntryDto entry) throws IOException {
        boolean defer = entry.deferSave() != null && entry.deferSave();
        return respond(workoutSessionUseCase.recordSet(trainingId, exerciseId, setIndex, entry.reps(), entry.weight(), defer));
    }

    @PutMapping(value = "/trainings/{trainingId}/bulk",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SessionOutcome> saveBulk(@PathVariable String trainingId, @RequestBody BulkEntryDto entry)
            throws IOException {
        return respond(workoutSessionUseCase.saveBulk(trainingId, toInputs(entry)));
    }

    @GetMapping(value = "/trainings/{trainingId}/bulk", produces = MediaType.APPLICATION_JSON_VALUE)
    public BulkSheet bulkSheet(@PathVariable String trainingId) throws IOException {
        return workoutSessionUseCase.bulkSheet(trainingId);
    }

    @PostMapping(value = "/trainings/{trainingId}/complete", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SessionOutcome> complete(@PathVariable String trainingId) throws IOException {
        return respond(workoutSessionUseCase.complete(trainingId));
    }

    @PostMapping(value = "/trainings/{trainingId}/save-and-exit", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SessionOutcome> saveAndExit(@PathVariable String trainingId) throws IOException {
        return respond(workoutSessionUseCase.saveAndExit(trainingId));
    }

    @GetMapping(value = "/trainings/{trainingId}/progress-report", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProgressReportDto progressReport(@PathVariable String trainingId) throws IOException {
        return ProgressReportDto.from(progressReportService.generateReport(trainingId));
    }

    private ResponseEntity<SessionOutcome> respond(SessionOutcome outcome) {
        HttpStatus status = switch (outcome.status()) {
            case SAVED, IGNORED -> HttpStatus.OK;
            case INVALID -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORE_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(outcome);
    }

    private Map<String, List<SetInput>> toInputs(BulkEntryDto entry) {
        Map<String, List<SetInput>> inputs = new LinkedHashMap<>();
        if (entry == null || entry.exercises() == null) {
            return inputs;
        }
        entry.exercises().forEach((exerciseId, rows) -> inputs.put(exerciseId, rows == null ? List.of() : rows.stream()
                .map(row -> row == null ? SetInput.blank() : new SetInput(row.reps(), row.weight()))
                .toList()));
        return inputs;
    }
}
