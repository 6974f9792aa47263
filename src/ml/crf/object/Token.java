package ml.crf.object;

import java.io.Serializable;
import java.util.Arrays;

/**
 * A single observation position: an ordered set of attributes (column 0 is usually the surface word)
 * and an optional label. Tokens are immutable, relabeling creates a new Token.
 */
public final class Token implements Serializable {

	private static final long serialVersionUID = 1L;

	/** Separates the label from the attributes in the serialized form */
	public static final String LABEL_SEPARATOR = "|--|";
	/** Separates the attributes from each other in the serialized form */
	public static final String TAG_SEPARATOR = "|-|";

	private final String label;
	private final String[] tags;

	private Token(String label, String[] tags){
		if(tags == null){
			throw new IllegalArgumentException("A token needs an attribute array");
		}
		this.label = label;
		this.tags = tags.clone();
	}

	/**
	 * Create a labeled token
	 * @param label
	 * @param tags
	 * @return
	 */
	public static Token put(String label, String[] tags){
		return new Token(label, tags);
	}

	/**
	 * Create an unlabeled token
	 * @param tags
	 * @return
	 */
	public static Token put(String[] tags){
		return new Token(null, tags);
	}

	/**
	 * Return a copy of this token carrying the specified label instead of the current one
	 * @param label
	 * @return
	 */
	public Token withLabel(String label){
		return new Token(label, tags);
	}

	public String label(){
		return label;
	}

	public boolean hasLabel(){
		return label != null;
	}

	public String word(){
		return tags.length > 0 ? tags[0] : "";
	}

	public int size(){
		return tags.length;
	}

	public String tag(int column){
		return tags[column];
	}

	public String[] tags(){
		return tags.clone();
	}

	/**
	 * Serialize as <code>label|--|tag0|-|tag1...</code>, the label part is empty for unlabeled tokens.
	 * An empty label reads back as no label, and a single empty attribute reads back as no attributes.
	 * @return
	 */
	public String serialize(){
		StringBuilder result = new StringBuilder();
		if(label != null){
			result.append(label);
		}
		result.append(LABEL_SEPARATOR);
		result.append(String.join(TAG_SEPARATOR, tags));
		return result.toString();
	}

	/**
	 * Inverse of {@link #serialize()}
	 * @param source
	 * @return
	 */
	public static Token deserialize(String source){
		int split = source.indexOf(LABEL_SEPARATOR);
		if(split < 0){
			throw new IllegalArgumentException("Incompatible formats in Token: "+source);
		}
		String label = source.substring(0, split);
		String rest = source.substring(split+LABEL_SEPARATOR.length());
		String[] tags = rest.isEmpty() ? new String[0] : rest.split("\\|-\\|", -1);
		return new Token(label.isEmpty() ? null : label, tags);
	}

	public String toString(){
		return word()+"/"+label;
	}

	public String conllString(){
		StringBuilder result = new StringBuilder();
		for(String tag: tags){
			result.append(tag+" ");
		}
		result.append(label);
		return result.toString();
	}

	@Override
	public boolean equals(Object o){
		if(o instanceof Token){
			Token t = (Token)o;
			return (label == null ? t.label == null : label.equals(t.label)) && Arrays.equals(tags, t.tags);
		}
		return false;
	}

	@Override
	public int hashCode(){
		return 31*Arrays.hashCode(tags)+(label == null ? 0 : label.hashCode());
	}
}
