package co.fanki.surveyflow.response.application;

import co.fanki.surveyflow.response.domain.AnswerPayload;
import co.fanki.surveyflow.response.domain.InvalidAnswerException;
import co.fanki.surveyflow.response.domain.Response;
import co.fanki.surveyflow.shared.DomainException;
import co.fanki.surveyflow.shared.InvalidStateException;
import co.fanki.surveyflow.shared.NotFoundException;
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
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for respondents moving through a survey.
 *
 * <p>Respondent-facing: failures carry a generic message with retry
 * guidance. Details, including internal identifiers, only go to the
 * log.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/responses")
@Tag(name = "Responses", description = "Start a response, answer questions and move through the flow")
public class ResponseController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ResponseController.class);

    /** Shown for any failure the respondent cannot fix. */
    static final String RETRY_MESSAGE =
            "Something went wrong. Please try again in a moment.";

    /** Shown when the survey or response cannot be found. */
    static final String NOT_FOUND_MESSAGE =
            "This survey is no longer available.";

    /** Shown when the response no longer accepts answers. */
    static final String CLOSED_MESSAGE =
            "This survey has already been completed or is closed.";

    /** Shown when the request itself is malformed. */
    static final String BAD_REQUEST_MESSAGE =
            "The request is incomplete. Please check your answer and try again.";

    private final ResponseService responseService;

    /**
     * Creates a new ResponseController.
     *
     * @param theResponseService the response service
     */
    public ResponseController(final ResponseService theResponseService) {
        this.responseService = theResponseService;
    }

    /**
     * Starts a response.
     *
     * @param request the start request
     * @return the response ID and the first question
     */
    @Operation(summary = "Start a response to an active survey")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Response started",
                    content = @Content(schema = @Schema(
                            implementation = StepResponse.class))),
            @ApiResponse(responseCode = "404", description = "Survey not found"),
            @ApiResponse(responseCode = "409", description = "Survey closed")
    })
    @PostMapping
    public ResponseEntity<StepResponse> start(
            @RequestBody final StartRequest request) {

        LOG.info("Starting response for survey {}", request.surveyId());

        try {
            final StartedResponse started = responseService.start(
                    request.surveyId(), request.respondentId());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new StepResponse(true, started.responseId(),
                            started.firstQuestionId(), false, null));
        } catch (final Exception e) {
            return failure(e);
        }
    }

    /**
     * Answers a question and resolves the next step.
     *
     * @param responseId the response ID
     * @param request the answered question and the answer
     * @return the next question, or completion
     */
    @Operation(
            summary = "Answer a question",
            description = "Stores the answer and returns the next question "
                    + "or marks the response complete."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer stored",
                    content = @Content(schema = @Schema(
                            implementation = StepResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid answer"),
            @ApiResponse(responseCode = "409", description = "Response closed")
    })
    @PostMapping("/{id}/answers")
    public ResponseEntity<StepResponse> answer(
            @Parameter(description = "Response ID")
            @PathVariable("id") final String responseId,
            @RequestBody final AnswerRequest request) {

        LOG.debug("Answer to question {} in response {}",
                request.currentQuestionId(), responseId);

        try {
            final NextStep next = responseService.resolveNext(responseId,
                    request.currentQuestionId(), request.answer());
            return ResponseEntity.ok(StepResponse.of(responseId, next));
        } catch (final Exception e) {
            return failure(e);
        }
    }

    /**
     * Gets the question a respondent continues with.
     *
     * @param responseId the response ID
     * @return the next question, or completion
     */
    @Operation(summary = "Get the next question of a response")
    @GetMapping("/{id}/next-question")
    public ResponseEntity<StepResponse> nextQuestion(
            @Parameter(description = "Response ID")
            @PathVariable("id") final String responseId) {
        try {
            return ResponseEntity.ok(StepResponse.of(responseId,
                    responseService.nextQuestion(responseId)));
        } catch (final Exception e) {
            return failure(e);
        }
    }

    /**
     * Completes a response.
     *
     * @param responseId the response ID
     * @return the completion result
     */
    @Operation(summary = "Complete a response")
    @PostMapping("/{id}/complete")
    public ResponseEntity<StepResponse> complete(
            @Parameter(description = "Response ID")
            @PathVariable("id") final String responseId) {
        try {
            final Response response = responseService.complete(responseId);
            return ResponseEntity.ok(new StepResponse(true, response.id(),
                    null, response.isComplete(), null));
        } catch (final Exception e) {
            return failure(e);
        }
    }

    private ResponseEntity<StepResponse> failure(final Exception e) {
        if (e instanceof InvalidAnswerException) {
            return ResponseEntity.badRequest()
                    .body(StepResponse.error(e.getMessage()));
        }
        if (e instanceof IllegalArgumentException) {
            LOG.warn("Malformed respondent request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(StepResponse.error(BAD_REQUEST_MESSAGE));
        }
        if (e instanceof NotFoundException) {
            LOG.warn("Respondent request failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(StepResponse.error(NOT_FOUND_MESSAGE));
        }
        if (e instanceof InvalidStateException) {
            LOG.warn("Respondent request failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(StepResponse.error(CLOSED_MESSAGE));
        }
        if (e instanceof DomainException domain) {
            LOG.error("Respondent request failed [{}]: {}",
                    domain.getErrorCode(), e.getMessage());
        } else {
            LOG.error("Unexpected error serving respondent", e);
        }
        return ResponseEntity.internalServerError()
                .body(StepResponse.error(RETRY_MESSAGE));
    }

    /**
     * Request to start a response.
     *
     * @param surveyId the survey to answer
     * @param respondentId who answers it
     */
    public record StartRequest(
            String surveyId,
            String respondentId
    ) {}

    /**
     * An answer to the current question.
     *
     * @param currentQuestionId the question being answered
     * @param answer the answer value
     */
    public record AnswerRequest(
            String currentQuestionId,
            AnswerPayload answer
    ) {}

    /**
     * Where the respondent goes next.
     *
     * @param success whether the request succeeded
     * @param responseId the response ID
     * @param nextQuestionId the question to show, null when complete
     * @param complete whether the response is finished
     * @param message a respondent-facing message on failure
     */
    public record StepResponse(
            boolean success,
            String responseId,
            String nextQuestionId,
            boolean complete,
            String message
    ) {

        static StepResponse of(final String responseId, final NextStep next) {
            return new StepResponse(true, responseId, next.nextQuestionId(),
                    next.complete(), null);
        }

        static StepResponse error(final String message) {
            return new StepResponse(false, null, null, false, message);
        }
    }

}
