package co.fanki.surveyflow.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the domain model.
 *
 * <p>Value objects are immutable, self-validating and compared by their
 * attributes. Navigation determinants and draft questions are the main
 * examples in this service.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
