package co.fanki.surveyflow.survey.application;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One question of a compile request, addressed by its array index.
 *
 * <p>A mutable bean rather than a record: an absent {@code defaultNextIndex}
 * means sequential navigation while an explicit {@code null} ends the
 * survey, and only a setter call can tell the two apart.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DraftQuestionRequest {

    private String text;
    private String kind;
    private boolean required;
    private List<String> options;
    private Integer defaultNextIndex;
    private boolean defaultNextIndexSpecified;
    private Map<Integer, Integer> optionNextIndexes;

    public String getText() {
        return text;
    }

    public void setText(final String theText) {
        this.text = theText;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(final String theKind) {
        this.kind = theKind;
    }

    @JsonProperty("isRequired")
    public boolean isRequired() {
        return required;
    }

    @JsonProperty("isRequired")
    public void setRequired(final boolean isRequired) {
        this.required = isRequired;
    }

    public List<String> getOptions() {
        return options;
    }

    public void setOptions(final List<String> theOptions) {
        this.options = theOptions;
    }

    public Integer getDefaultNextIndex() {
        return defaultNextIndex;
    }

    /**
     * Sets the default next index; any call, even with null, marks it as
     * specified.
     *
     * @param index the draft index, -1 for sequential, null to end
     */
    public void setDefaultNextIndex(final Integer index) {
        this.defaultNextIndex = index;
        this.defaultNextIndexSpecified = true;
    }

    public boolean isDefaultNextIndexSpecified() {
        return defaultNextIndexSpecified;
    }

    public Map<Integer, Integer> getOptionNextIndexes() {
        return optionNextIndexes;
    }

    public void setOptionNextIndexes(final Map<Integer, Integer> indexes) {
        this.optionNextIndexes = indexes;
    }

}
