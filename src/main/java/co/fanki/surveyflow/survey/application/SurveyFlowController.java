package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.CycleDetectedException;
import co.fanki.surveyflow.flow.domain.FlowValidationException;
import co.fanki.surveyflow.flow.domain.FlowValidationResult;
import co.fanki.surveyflow.shared.DomainException;
import co.fanki.surveyflow.shared.NotFoundException;
import co.fanki.surveyflow.shared.TransactionAbortedException;
import co.fanki.surveyflow.survey.application.SurveyController.SurveyResponse;
import co.fanki.surveyflow.survey.domain.FieldError;
import co.fanki.surveyflow.survey.domain.StructuralValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for authoring a survey's question flow.
 *
 * <p>Author-facing: failures carry every problem found, including the
 * exact cycle path, so the author can fix the draft in one pass.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/surveys/{id}")
@Tag(name = "Survey Flow", description = "Replace and validate the question flow of a survey")
public class SurveyFlowController {

    private static final Logger LOG = LoggerFactory.getLogger(
            SurveyFlowController.class);

    private final BatchFlowCompiler batchFlowCompiler;
    private final FlowValidationService flowValidationService;

    /**
     * Creates a new SurveyFlowController.
     *
     * @param theBatchFlowCompiler the batch compiler
     * @param theFlowValidationService the flow validation service
     */
    public SurveyFlowController(final BatchFlowCompiler theBatchFlowCompiler,
            final FlowValidationService theFlowValidationService) {
        this.batchFlowCompiler = theBatchFlowCompiler;
        this.flowValidationService = theFlowValidationService;
    }

    /**
     * Replaces every question of a survey from an index-addressed draft.
     *
     * @param surveyId the survey ID
     * @param request the draft questions
     * @return the compiled survey or every problem found
     */
    @Operation(
            summary = "Replace the survey questions",
            description = "Atomically replaces the questions and flow of a survey. "
                    + "Navigation targets are draft array indexes: -1 means "
                    + "sequential, null ends the survey. Deletes every existing "
                    + "response of the survey."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Survey compiled",
                    content = @Content(schema = @Schema(
                            implementation = CompileResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid draft"),
            @ApiResponse(responseCode = "404", description = "Survey not found"),
            @ApiResponse(responseCode = "500", description = "Update rolled back")
    })
    @PutMapping("/questions")
    public ResponseEntity<CompileResponse> compile(
            @Parameter(description = "Survey ID")
            @PathVariable("id") final String surveyId,
            @RequestBody final CompileSurveyRequest request) {

        LOG.info("Received compile request for survey {}", surveyId);

        try {
            final CompiledSurvey compiled = batchFlowCompiler.compile(
                    surveyId, request.toCommand());
            return ResponseEntity.ok(new CompileResponse(
                    SurveyResponse.of(compiled.survey(), compiled.questions(),
                            "Survey updated"),
                    List.of(), List.of(), List.of()));

        } catch (final StructuralValidationException e) {
            return ResponseEntity.badRequest().body(CompileResponse.failed(
                    e.getErrorCode(), e.getMessage(), e.fieldErrors(),
                    List.of(), List.of()));
        } catch (final FlowValidationException e) {
            final List<?> cyclePath = e instanceof CycleDetectedException cycle
                    ? cycle.cyclePath() : List.of();
            return ResponseEntity.badRequest().body(CompileResponse.failed(
                    e.getErrorCode(), e.getMessage(), List.of(), e.errors(),
                    cyclePath));
        } catch (final NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(CompileResponse.failed(e.getErrorCode(),
                            e.getMessage(), List.of(), List.of(), List.of()));
        } catch (final TransactionAbortedException e) {
            return ResponseEntity.internalServerError()
                    .body(CompileResponse.failed(e.getErrorCode(),
                            e.getMessage(), List.of(), List.of(), List.of()));
        } catch (final DomainException e) {
            LOG.error("Compile failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(CompileResponse.failed(
                    e.getErrorCode(), e.getMessage(), List.of(), List.of(),
                    List.of()));
        } catch (final Exception e) {
            LOG.error("Unexpected error compiling survey {}", surveyId, e);
            return ResponseEntity.internalServerError()
                    .body(CompileResponse.failed("INTERNAL_ERROR",
                            "Internal error: " + e.getMessage(), List.of(),
                            List.of(), List.of()));
        }
    }

    /**
     * Validates the flow a survey currently has.
     *
     * @param surveyId the survey ID
     * @return whether the flow is valid, with every problem found
     */
    @Operation(
            summary = "Validate the survey flow",
            description = "Checks the stored flow for cycles, unreachable "
                    + "questions, invalid targets and missing completion paths."
    )
    @GetMapping("/flow/validation")
    public ResponseEntity<ValidationResponse> validate(
            @Parameter(description = "Survey ID")
            @PathVariable("id") final String surveyId) {

        LOG.debug("Validating flow of survey {}", surveyId);

        try {
            final FlowValidationResult<String> result =
                    flowValidationService.validate(surveyId);
            return ResponseEntity.ok(new ValidationResponse(result.valid(),
                    result.errors(), result.cyclePath(),
                    result.unreachable(), null));
        } catch (final NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ValidationResponse(false, List.of(), List.of(),
                            List.of(), e.getMessage()));
        } catch (final Exception e) {
            LOG.error("Unexpected error validating survey {}", surveyId, e);
            return ResponseEntity.internalServerError()
                    .body(new ValidationResponse(false, List.of(), List.of(),
                            List.of(), "Internal error: " + e.getMessage()));
        }
    }

    /**
     * Result of a compile request.
     *
     * @param survey the compiled survey, null on failure
     * @param fieldErrors per-field problems of the draft
     * @param flowErrors flow graph problems of the draft
     * @param cyclePath the draft indexes forming a cycle, if any
     */
    public record CompileResponse(
            SurveyResponse survey,
            List<FieldError> fieldErrors,
            List<String> flowErrors,
            List<?> cyclePath
    ) {

        static CompileResponse failed(final String errorCode,
                final String message, final List<FieldError> fieldErrors,
                final List<String> flowErrors, final List<?> cyclePath) {
            return new CompileResponse(
                    SurveyResponse.error(errorCode + ": " + message),
                    fieldErrors, flowErrors, cyclePath);
        }
    }

    /**
     * Result of a flow validation.
     *
     * @param valid whether the flow is well-formed
     * @param errors every problem found
     * @param cyclePath the question ids forming a cycle, if any
     * @param unreachable the ids of questions not reachable from the start
     * @param message an error message when the survey could not be loaded
     */
    public record ValidationResponse(
            boolean valid,
            List<String> errors,
            List<String> cyclePath,
            List<String> unreachable,
            String message
    ) {}

}
