package co.fanki.surveyflow.survey.application;

import co.fanki.surveyflow.flow.domain.NavigationDeterminant;
import co.fanki.surveyflow.shared.NotFoundException;
import co.fanki.surveyflow.survey.domain.Question;
import co.fanki.surveyflow.survey.domain.Survey;
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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for creating and reading surveys.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/surveys")
@Tag(name = "Surveys", description = "Create surveys and read their questions")
public class SurveyController {

    private static final Logger LOG = LoggerFactory.getLogger(
            SurveyController.class);

    private final SurveyService surveyService;

    /**
     * Creates a new SurveyController.
     *
     * @param theSurveyService the survey service
     */
    public SurveyController(final SurveyService theSurveyService) {
        this.surveyService = theSurveyService;
    }

    /**
     * Creates an empty, inactive survey.
     *
     * @param request the creation request
     * @return the created survey
     */
    @Operation(
            summary = "Create a survey",
            description = "Creates an inactive survey without questions. "
                    + "Questions are added through the batch compile endpoint."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Survey created",
                    content = @Content(schema = @Schema(
                            implementation = SurveyResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid title")
    })
    @PostMapping
    public ResponseEntity<SurveyResponse> createSurvey(
            @RequestBody final CreateSurveyRequest request) {

        LOG.info("Received create survey request: {}", request.title());

        try {
            final Survey survey = surveyService.createSurvey(
                    request.title(), request.description());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(SurveyResponse.of(survey, List.of(), null));
        } catch (final IllegalArgumentException e) {
            LOG.warn("Create survey rejected: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(SurveyResponse.error(e.getMessage()));
        }
    }

    /**
     * Gets a survey with its questions and navigation.
     *
     * @param surveyId the survey ID
     * @return the survey
     */
    @Operation(summary = "Get a survey with its questions")
    @GetMapping("/{id}")
    public ResponseEntity<SurveyResponse> getSurvey(
            @Parameter(description = "Survey ID")
            @PathVariable("id") final String surveyId) {

        LOG.debug("Getting survey {}", surveyId);

        try {
            final CompiledSurvey survey = surveyService.getWithQuestions(
                    surveyId);
            return ResponseEntity.ok(SurveyResponse.of(survey.survey(),
                    survey.questions(), null));
        } catch (final NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(SurveyResponse.error(e.getMessage()));
        }
    }

    /**
     * Request for survey creation.
     *
     * @param title the title, 3 to 500 characters
     * @param description the optional description
     */
    public record CreateSurveyRequest(
            String title,
            String description
    ) {}

    /**
     * A survey with its questions.
     *
     * @param success whether the request succeeded
     * @param id the survey ID
     * @param title the title
     * @param description the description
     * @param isActive whether respondents may start it
     * @param version the flow version
     * @param updatedAt when last updated
     * @param questions the questions in order
     * @param message a human-readable result message
     */
    public record SurveyResponse(
            boolean success,
            String id,
            String title,
            String description,
            boolean isActive,
            int version,
            Instant updatedAt,
            List<QuestionResponse> questions,
            String message
    ) {

        static SurveyResponse of(final Survey survey,
                final List<Question> questions, final String message) {
            return new SurveyResponse(true, survey.id(), survey.title(),
                    survey.description(), survey.isActive(),
                    survey.version(), survey.updatedAt(),
                    questions.stream().map(QuestionResponse::of).toList(),
                    message);
        }

        static SurveyResponse error(final String message) {
            return new SurveyResponse(false, null, null, null, false, 0,
                    null, List.of(), message);
        }
    }

    /**
     * A persisted question.
     *
     * @param id the question ID
     * @param orderIndex the order position
     * @param text the question text
     * @param kind the question kind
     * @param isRequired whether an answer is mandatory
     * @param options the option texts
     * @param defaultNext the default navigation
     * @param optionNext per-option navigation, keyed by option index
     */
    public record QuestionResponse(
            String id,
            int orderIndex,
            String text,
            String kind,
            boolean isRequired,
            List<String> options,
            StepResponse defaultNext,
            Map<Integer, StepResponse> optionNext
    ) {

        static QuestionResponse of(final Question question) {
            final Map<Integer, StepResponse> overrides = new LinkedHashMap<>();
            question.optionNext().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(entry -> overrides.put(entry.getKey(),
                            StepResponse.of(entry.getValue())));
            return new QuestionResponse(question.id(), question.orderIndex(),
                    question.text(), question.kind().name(),
                    question.required(), question.options(),
                    StepResponse.of(question.defaultNext()), overrides);
        }
    }

    /**
     * A navigation determinant.
     *
     * @param type GO_TO_QUESTION, END_SURVEY or SEQUENTIAL
     * @param questionId the target question, only for GO_TO_QUESTION
     */
    public record StepResponse(
            String type,
            String questionId
    ) {

        static StepResponse of(final NavigationDeterminant<String> step) {
            return new StepResponse(step.type().name(), step.target());
        }
    }

}
