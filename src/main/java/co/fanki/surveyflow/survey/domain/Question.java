package co.fanki.surveyflow.survey.domain;

import co.fanki.surveyflow.flow.domain.DraftQuestion;
import co.fanki.surveyflow.flow.domain.FlowNode;
import co.fanki.surveyflow.flow.domain.NavigationDeterminant;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import co.fanki.surveyflow.shared.Preconditions;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A persisted survey question with its navigation.
 *
 * <p>Questions are created from a {@link DraftQuestion} without navigation
 * and receive their translated determinants in a second step, once every
 * question of the survey has an id.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Question {

    private final String id;
    private final String surveyId;
    private final int orderIndex;
    private final String text;
    private final QuestionKind kind;
    private final boolean required;
    private final List<String> options;
    private NavigationDeterminant<String> defaultNext;
    private Map<Integer, NavigationDeterminant<String>> optionNext;
    private final Instant createdAt;

    private Question(final String theId, final String theSurveyId,
            final int theOrderIndex, final String theText,
            final QuestionKind theKind, final boolean isRequired,
            final List<String> theOptions, final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Question ID is required");
        this.surveyId = Preconditions.requireNonBlank(theSurveyId,
                "Survey ID is required");
        this.orderIndex = Preconditions.requireNonNegative(theOrderIndex,
                "Order index must be non-negative");
        this.text = Preconditions.requireNonBlank(theText,
                "Question text is required");
        this.kind = Preconditions.requireNonNull(theKind,
                "Question kind is required");
        this.required = isRequired;
        this.options = theOptions != null ? List.copyOf(theOptions) : List.of();
        this.defaultNext = NavigationDeterminant.sequential();
        this.optionNext = Map.of();
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Creates a question from its draft, without navigation.
     *
     * <p>Text and options are stored trimmed, the form they were checked
     * in.</p>
     *
     * @param surveyId the owning survey
     * @param orderIndex the order position, equal to the draft index
     * @param draft the submitted question
     * @return a new Question instance
     */
    public static Question fromDraft(final String surveyId,
            final int orderIndex, final DraftQuestion draft) {
        final List<String> options = draft.options().stream()
                .map(String::trim)
                .toList();
        return new Question(UUID.randomUUID().toString(), surveyId,
                orderIndex, draft.text().trim(), draft.kind(),
                draft.required(), options, Instant.now());
    }

    /**
     * Reconstitutes a question from persistence.
     *
     * @param id the question ID
     * @param surveyId the survey ID
     * @param orderIndex the order position
     * @param text the question text
     * @param kind the question kind
     * @param required whether an answer is mandatory
     * @param options the option texts
     * @param defaultNext the default determinant
     * @param optionNext the per-option overrides
     * @param createdAt when created
     * @return the reconstituted Question
     */
    public static Question reconstitute(final String id, final String surveyId,
            final int orderIndex, final String text, final QuestionKind kind,
            final boolean required, final List<String> options,
            final NavigationDeterminant<String> defaultNext,
            final Map<Integer, NavigationDeterminant<String>> optionNext,
            final Instant createdAt) {
        final Question question = new Question(id, surveyId, orderIndex, text,
                kind, required, options, createdAt);
        question.assignFlow(defaultNext, optionNext);
        return question;
    }

    /**
     * Installs the navigation of this question.
     *
     * @param theDefaultNext the default determinant
     * @param theOptionNext the per-option overrides, may be null
     */
    public void assignFlow(final NavigationDeterminant<String> theDefaultNext,
            final Map<Integer, NavigationDeterminant<String>> theOptionNext) {
        this.defaultNext = Preconditions.requireNonNull(theDefaultNext,
                "Default determinant is required");
        this.optionNext = theOptionNext != null
                ? Map.copyOf(theOptionNext) : Map.of();
    }

    /**
     * Projects this question into a flow graph node.
     *
     * @return the node addressed by this question's id
     */
    public FlowNode<String> toFlowNode() {
        return new FlowNode<>(id, orderIndex, kind,
                kind.branchOptionCount(options.size()), defaultNext,
                optionNext, text);
    }

    /**
     * Finds the index of an option by its text.
     *
     * @param optionText the option text
     * @return the 0-based index, or -1 if no option matches
     */
    public int optionIndex(final String optionText) {
        return options.indexOf(optionText);
    }

    public String id() {
        return id;
    }

    public String surveyId() {
        return surveyId;
    }

    public int orderIndex() {
        return orderIndex;
    }

    public String text() {
        return text;
    }

    public QuestionKind kind() {
        return kind;
    }

    public boolean required() {
        return required;
    }

    public List<String> options() {
        return options;
    }

    public NavigationDeterminant<String> defaultNext() {
        return defaultNext;
    }

    public Map<Integer, NavigationDeterminant<String>> optionNext() {
        return optionNext;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
