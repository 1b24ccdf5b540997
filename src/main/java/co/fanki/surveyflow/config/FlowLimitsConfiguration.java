package co.fanki.surveyflow.config;

import co.fanki.surveyflow.survey.domain.QuestionLimits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the authoring limits from {@code surveyflow.limits.*}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class FlowLimitsConfiguration {

    @Value("${surveyflow.limits.min-text-length:3}")
    private int minTextLength;

    @Value("${surveyflow.limits.max-text-length:5000}")
    private int maxTextLength;

    @Value("${surveyflow.limits.min-options:2}")
    private int minOptions;

    @Value("${surveyflow.limits.max-options:10}")
    private int maxOptions;

    @Value("${surveyflow.limits.max-option-length:500}")
    private int maxOptionLength;

    @Value("${surveyflow.limits.max-questions:100}")
    private int maxQuestions;

    /**
     * Builds the question limits.
     *
     * @return the configured limits
     */
    @Bean
    public QuestionLimits questionLimits() {
        return new QuestionLimits(minTextLength, maxTextLength, minOptions,
                maxOptions, maxOptionLength, maxQuestions);
    }

}
