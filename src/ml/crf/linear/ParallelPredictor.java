package ml.crf.linear;

import java.io.Closeable;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import edu.stanford.nlp.util.PropertiesUtils;
import ml.crf.object.Sequence;

/**
 * Decodes batches of sequences on a fixed pool of worker threads.
 * All workers share the same immutable {@link CRFModel}, so the labels of each sequence do not depend on
 * which thread decodes it or in which order.
 */
public class ParallelPredictor implements StructuredClassifier, Closeable {

	public static final String NUM_THREADS = "crf.numThreads";
	public static final String USE_MULTI_THREAD = "crf.useMultiThread";
	public static final String COST_FACTOR = "crf.costFactor";

	private final CRFModel model;

	public boolean useMultiThread = true;
	public int numThreads = 8;
	public double costFactor = 1.0;

	private ExecutorService executor;

	public ParallelPredictor(CRFModel model){
		this.model = model;
		model.featureIndex();
	}

	/**
	 * Read crf.numThreads, crf.useMultiThread and crf.costFactor, keeping the current value for missing keys.
	 * Must be called before the first prediction.
	 * @param props
	 * @return this predictor
	 */
	public synchronized ParallelPredictor configure(Properties props){
		if(executor != null){
			throw new IllegalStateException("Cannot reconfigure a predictor that has already started its workers");
		}
		numThreads = PropertiesUtils.getInt(props, NUM_THREADS, numThreads);
		useMultiThread = PropertiesUtils.getBool(props, USE_MULTI_THREAD, useMultiThread);
		costFactor = PropertiesUtils.getDouble(props, COST_FACTOR, costFactor);
		if(numThreads <= 0){
			throw new IllegalArgumentException(NUM_THREADS+" must be positive, got "+numThreads);
		}
		return this;
	}

	public CRFModel model(){
		return model;
	}

	@Override
	public List<Sequence> predict(List<Sequence> testData){
		return predict(testData, costFactor);
	}

	public List<Sequence> predict(List<Sequence> testData, double costFactor){
		if(!useMultiThread){
			return model.predict(testData, costFactor);
		}
		return model.predict(testData, costFactor, executor());
	}

	@Override
	public List<String> getLabels(){
		return model.getLabels();
	}

	/** Starts the workers on first use, and again after {@link #close()} */
	private synchronized ExecutorService executor(){
		if(executor == null){
			executor = Executors.newFixedThreadPool(numThreads);
		}
		return executor;
	}

	@Override
	public synchronized void close(){
		if(executor != null){
			executor.shutdown();
			executor = null;
		}
	}
}
