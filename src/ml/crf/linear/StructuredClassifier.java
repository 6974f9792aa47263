package ml.crf.linear;

import java.util.List;

import ml.crf.object.Sequence;

public interface StructuredClassifier {

	/**
	 * Predict the sequence of labels of the given test data
	 * @param testData
	 * @return
	 */
	public List<Sequence> predict(List<Sequence> testData);

	/**
	 * Return the list of labels, in label index order
	 * @return
	 */
	public List<String> getLabels();
}
