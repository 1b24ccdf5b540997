package co.fanki.surveyflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Survey Flow Application.
 *
 * <p>Main entry point for the survey flow engine: authors compile branching
 * question flows into surveys, and respondents move through them one
 * answer at a time.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class SurveyFlowApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(SurveyFlowApplication.class, args);
    }

}
