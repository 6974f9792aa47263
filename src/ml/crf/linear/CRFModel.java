package ml.crf.linear;

import static edu.stanford.nlp.util.logging.Redwood.Util.endTrack;
import static edu.stanford.nlp.util.logging.Redwood.Util.forceTrack;
import static edu.stanford.nlp.util.logging.Redwood.Util.log;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Serializable;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import ml.crf.object.Sequence;

/**
 * A trained linear-chain CRF: the header, the frozen feature dictionary and the weight vector.
 * <p>
 * Models never change after construction and can be shared by any number of concurrent decodes.
 * Two models with equal header, dictionary and weights are interchangeable.
 */
public final class CRFModel implements StructuredClassifier, Serializable {

	private static final long serialVersionUID = 1L;

	/** Separates the header, dictionary and weight sections */
	public static final String SECTION_SEPARATOR = "|--|";
	/** Separates a feature key from its ID */
	public static final String ENTRY_SEPARATOR = "|-|";

	public static final String HEAD_FILE = "head";
	public static final String ALPHA_FILE = "alpha";

	private final List<String> head;
	private final Map<String, Integer> dic;
	private final double[] alpha;

	/**
	 * Create a model. The dictionary iteration order is kept for serialization.
	 * @param head
	 * @param dic
	 * @param alpha
	 */
	public CRFModel(List<String> head, Map<String, Integer> dic, double[] alpha){
		this.head = Collections.unmodifiableList(new ArrayList<String>(head));
		this.dic = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(dic));
		this.alpha = alpha.clone();
	}

	public List<String> head(){
		return head;
	}

	public Map<String, Integer> dic(){
		return dic;
	}

	/**
	 * Return a copy of the weights
	 * @return
	 */
	public double[] alpha(){
		return alpha.clone();
	}

	public double alpha(int featureId){
		return alpha[featureId];
	}

	public int alphaSize(){
		return alpha.length;
	}

	/** The weights without copying, only for read-only use inside this package */
	double[] weights(){
		return alpha;
	}

	/**
	 * Bind a fresh feature index to this model, validating the header against the dictionary and weights
	 * @return
	 */
	public FeatureIndex featureIndex(){
		FeatureIndex featureIndex = new FeatureIndex();
		featureIndex.readModel(this);
		return featureIndex;
	}

	@Override
	public List<String> getLabels(){
		return featureIndex().labels();
	}

	@Override
	public List<Sequence> predict(List<Sequence> tests){
		return predict(tests, 1.0);
	}

	/**
	 * Decode every sequence, one after the other
	 * @param tests
	 * @param costFactor
	 * @return the sequences with the predicted labels, in input order
	 */
	public List<Sequence> predict(List<Sequence> tests, double costFactor){
		featureIndex();
		List<Sequence> results = new ArrayList<Sequence>(tests.size());
		for(Sequence test: tests){
			results.add(decode(test, costFactor, false));
		}
		return results;
	}

	/**
	 * Decode every sequence as a separate task on the specified executor
	 * @param tests
	 * @param costFactor
	 * @param executor
	 * @return the sequences with the predicted labels, in input order
	 */
	public List<Sequence> predict(List<Sequence> tests, double costFactor, ExecutorService executor){
		featureIndex();
		forceTrack("Predicting "+tests.size()+" sequences");
		List<Callable<Sequence>> tasks = new ArrayList<Callable<Sequence>>(tests.size());
		for(Sequence test: tests){
			tasks.add(new Callable<Sequence>() {

				@Override
				public Sequence call() throws Exception {
					return decode(test, costFactor, false);
				}
			});
		}
		List<Sequence> results = new ArrayList<Sequence>(tests.size());
		try {
			for(Future<Sequence> f: executor.invokeAll(tasks)){
				results.add(f.get());
			}
			log(String.format("Decoded %d sequences", results.size()));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while predicting", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if(cause instanceof RuntimeException){
				throw (RuntimeException)cause;
			}
			throw new IllegalStateException("Failed to decode a sequence", cause);
		} finally {
			endTrack("Predicting "+tests.size()+" sequences");
		}
		return results;
	}

	/**
	 * Decode a single sequence
	 * @param test
	 * @param costFactor
	 * @return the sequence with the predicted labels in place of its previous ones
	 */
	public Sequence decode(Sequence test, double costFactor){
		return decode(test, costFactor, true);
	}

	private Sequence decode(Sequence test, double costFactor, boolean checkModel){
		FeatureIndex featureIndex = new FeatureIndex();
		featureIndex.readModel(this, checkModel);
		Tagger tagger = new Tagger(featureIndex.ysize());
		tagger.setCostFactor(costFactor);
		tagger.read(test, featureIndex);
		featureIndex.buildFeatures(tagger);
		tagger.parse(featureIndex.alpha());
		String[] labels = new String[test.size()];
		for(int i=0; i<labels.length; i++){
			labels[i] = featureIndex.label(tagger.result(i));
		}
		return test.withLabels(labels);
	}

	/**
	 * The header and dictionary sections of the text format
	 * @return
	 */
	public String toStringHead(){
		StringBuilder result = new StringBuilder();
		result.append(String.join("\t", head));
		result.append(SECTION_SEPARATOR);
		boolean first = true;
		for(Map.Entry<String, Integer> entry: dic.entrySet()){
			if(!first) result.append("\t");
			result.append(entry.getKey()).append(ENTRY_SEPARATOR).append(entry.getValue());
			first = false;
		}
		return result.toString();
	}

	/**
	 * The text format: header, dictionary and weights (rounded to float) separated by "|--|"
	 */
	@Override
	public String toString(){
		StringBuilder result = new StringBuilder(toStringHead());
		result.append(SECTION_SEPARATOR);
		for(int i=0; i<alpha.length; i++){
			if(i > 0) result.append("\t");
			result.append(Float.toString((float)alpha[i]));
		}
		return result.toString();
	}

	public static String save(CRFModel model){
		return model.toString();
	}

	/**
	 * Parse a model from its text format
	 * @param source
	 * @return
	 * @throws ModelFormatException if the text is malformed
	 */
	public static CRFModel load(String source){
		String[] components = splitSections(source, 3);
		List<String> head = splitFields(components[0]);
		Map<String, Integer> dic = parseDictionary(components[1]);
		List<String> weights = splitFields(components[2]);
		double[] alpha = new double[weights.size()];
		for(int i=0; i<alpha.length; i++){
			try{
				alpha[i] = Double.parseDouble(weights.get(i));
			} catch (NumberFormatException e){
				throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT, e);
			}
		}
		return new CRFModel(head, dic, alpha);
	}

	/**
	 * Write the model to dir/head (header and dictionary) and dir/alpha (weights as raw big-endian floats).
	 * The weights lose double precision.
	 * @param model
	 * @param path
	 * @throws IOException
	 */
	public static void saveBinaryFile(CRFModel model, String path) throws IOException{
		File dir = new File(path);
		try (Writer wr = new OutputStreamWriter(new FileOutputStream(new File(dir, HEAD_FILE)), StandardCharsets.UTF_8)) {
			wr.write(model.toStringHead());
		}
		try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(new FileOutputStream(new File(dir, ALPHA_FILE))))) {
			for(double value: model.alpha){
				out.writeFloat((float)value);
			}
		}
		log(String.format("Saved model with %d features and %d weights to %s", model.dic.size(), model.alpha.length, path));
	}

	/**
	 * Read a model written by {@link #saveBinaryFile(CRFModel, String)}
	 * @param path
	 * @return
	 * @throws IOException
	 * @throws ModelFormatException if either file is malformed
	 */
	public static CRFModel loadBinaryFile(String path) throws IOException{
		File dir = new File(path);
		String source;
		try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(new File(dir, HEAD_FILE)), StandardCharsets.UTF_8))) {
			source = br.readLine();
		}
		if(source == null){
			throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT);
		}
		String[] components = splitSections(source, 2);
		List<String> head = splitFields(components[0]);
		Map<String, Integer> dic = parseDictionary(components[1]);
		if(head.size() < 2){
			throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT);
		}
		int size;
		try{
			size = Integer.parseInt(head.get(1));
		} catch (NumberFormatException e){
			throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT, e);
		}
		if(size < 0){
			throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT);
		}
		File alphaFile = new File(dir, ALPHA_FILE);
		if(4L*size > alphaFile.length()){
			throw new ModelFormatException(String.format("Expected %d weights but %s has %d bytes", size, ALPHA_FILE, alphaFile.length()));
		}
		double[] alpha = new double[size];
		try (DataInputStream in = new DataInputStream(new BufferedInputStream(new FileInputStream(alphaFile)))) {
			for(int i=0; i<size; i++){
				alpha[i] = in.readFloat();
			}
		} catch (EOFException e){
			throw new ModelFormatException(String.format("Expected %d weights in %s", size, ALPHA_FILE), e);
		}
		log(String.format("Loaded model with %d features and %d weights from %s", dic.size(), size, path));
		return new CRFModel(head, dic, alpha);
	}

	private static String[] splitSections(String source, int expected){
		String[] components = source.split("\\|--\\|", -1);
		if(components.length != expected){
			throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT);
		}
		return components;
	}

	private static List<String> splitFields(String section){
		if(section.isEmpty()){
			return new ArrayList<String>();
		}
		return Arrays.asList(section.split("\t", -1));
	}

	private static Map<String, Integer> parseDictionary(String section){
		Map<String, Integer> dic = new LinkedHashMap<String, Integer>();
		for(String entry: splitFields(section)){
			String[] parts = entry.split("\\|-\\|", -1);
			if(parts.length != 2){
				throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT);
			}
			Integer previous;
			try{
				previous = dic.put(parts[0], Integer.parseInt(parts[1]));
			} catch (NumberFormatException e){
				throw new ModelFormatException(ModelFormatException.INCOMPATIBLE_FORMAT, e);
			}
			if(previous != null){
				throw new ModelFormatException("Duplicate feature in Model file: "+parts[0]);
			}
		}
		return dic;
	}

	@Override
	public boolean equals(Object o){
		if(o instanceof CRFModel){
			CRFModel m = (CRFModel)o;
			return head.equals(m.head) && dic.equals(m.dic) && Arrays.equals(alpha, m.alpha);
		}
		return false;
	}

	@Override
	public int hashCode(){
		return 31*(31*head.hashCode()+dic.hashCode())+Arrays.hashCode(alpha);
	}
}
