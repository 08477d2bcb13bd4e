package com.bko.workouttracker.tracking.web;

import com.bko.workouttracker.tracking.Measurement;
import com.bko.workouttracker.tracking.NutritionEntry;
import com.bko.workouttracker.tracking.StepsEntry;
import com.bko.workouttracker.tracking.TodaySteps;
import com.bko.workouttracker.tracking.app.MeasurementService;
import com.bko.workouttracker.tracking.app.NutritionService;
import com.bko.workouttracker.tracking.app.StepsService;
import com.bko.workouttracker.tracking.web.dto.FoodLogRequestDto;
import com.bko.workouttracker.tracking.web.dto.MeasurementRequestDto;
import com.bko.workouttracker.tracking.web.dto.StepsRequestDto;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/trainees/{traineeId}")
public class TrackingController {
    private final MeasurementService measurementService;
    private final StepsService stepsService;
    private final NutritionService nutritionService;

    public TrackingController(MeasurementService measurementService,
                              StepsService stepsService,
                              NutritionService nutritionService) {
        this.measurementService = measurementService;
        this.stepsService = stepsService;
        this.nutritionService = nutritionService;
    }

    @GetMapping(value = "/measurements", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Measurement> measurements(@PathVariable String traineeId) throws IOException {
        return measurementService.history(traineeId);
    }

    @PostMapping(value = "/measurements", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Measurement recordMeasurement(@PathVariable String traineeId, @RequestBody MeasurementRequestDto request)
            throws IOException {
        if (request.weight() == null) {
            throw new IllegalArgumentException("Weight is required");
        }
        return measurementService.record(traineeId, request.weight(), request.bodyMeasurements());
    }

    @PatchMapping(value = "/measurements/{measurementId}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Measurement> updateBodyMeasurements(@PathVariable String traineeId,
                                                              @PathVariable String measurementId,
                                                              @RequestBody Map<String, Double> bodyMeasurements)
            throws IOException {
        return ResponseEntity.of(measurementService.updateBodyMeasurements(measurementId, bodyMeasurements));
    }

    @DeleteMapping("/measurements/{measurementId}")
    public ResponseEntity<Void> deleteMeasurement(@PathVariable String traineeId, @PathVariable String measurementId)
            throws IOException {
        measurementService.delete(measurementId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping(value = "/steps/today", produces = MediaType.APPLICATION_JSON_VALUE)
    public TodaySteps todaySteps(@PathVariable String traineeId) throws IOException {
        return stepsService.todaySteps(traineeId);
    }

    @GetMapping(value = "/steps", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<StepsEntry> steps(@PathVariable String traineeId) throws IOException {
        return stepsService.history(traineeId);
    }

    @PutMapping(value = "/steps", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public StepsEntry logSteps(@PathVariable String traineeId, @RequestBody StepsRequestDto request) throws IOException {
        if (request.steps() == null) {
            throw new IllegalArgumentException("Steps are required");
        }
        return stepsService.logManual(traineeId, request.date(), request.steps());
    }

    @GetMapping(value = "/nutrition/today", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<NutritionEntry> todayNutrition(@PathVariable String traineeId) throws IOException {
        return ResponseEntity.of(nutritionService.today(traineeId));
    }

    @PostMapping(value = "/nutrition/foods", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public NutritionEntry logFoods(@PathVariable String traineeId, @RequestBody FoodLogRequestDto request)
            throws IOException {
        return nutritionService.logFoods(traineeId, request.foods());
    }
}
