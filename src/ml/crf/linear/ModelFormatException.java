package ml.crf.linear;

/**
 * Thrown when a text or binary model artifact is malformed, or when a model's header does not agree
 * with its dictionary and weights.
 */
public class ModelFormatException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	/** The message for structural errors in the serialized model */
	public static final String INCOMPATIBLE_FORMAT = "Incompatible formats in Model file";

	public ModelFormatException(String message){
		super(message);
	}

	public ModelFormatException(String message, Throwable cause){
		super(message, cause);
	}
}
