package com.models_api.plugin;

import com.models_api.exception.ModelExecutionException;
import com.models_api.util.AlgorithmUtil;
import com.models_api.util.WekaDatasetUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import weka.classifiers.Classifier;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SerializationHelper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps a Weka classifier or regressor. Every input retrains the algorithm from scratch on the
 * given rows; output appends a {@code prediction} field to each row.
 *
 * <p>Settings: {@code algorithm} (classifier class name), {@code options} (Weka option string),
 * {@code target} (class column, last column when absent). Input options may override
 * {@code target}.</p>
 */
@Component
@Slf4j
public class WekaModelPlugin implements ModelPlugin<WekaModelState> {

    public static final String TYPE = "weka";
    public static final String DEFAULT_ALGORITHM = "weka.classifiers.functions.LinearRegression";
    static final String PREDICTION_COLUMN = "prediction";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String getDescription() {
        return "Weka classifier or regressor (settings: algorithm, options, target). Output appends a prediction field.";
    }

    @Override
    public WekaModelState initialize(Map<String, Object> settings) {
        Map<String, Object> safe = settings == null ? Map.of() : settings;
        String algorithm = stringOrDefault(safe.get("algorithm"), DEFAULT_ALGORITHM);
        if (!AlgorithmUtil.isClassifier(algorithm)) {
            throw new IllegalArgumentException("Not a Weka classifier: " + algorithm);
        }
        return WekaModelState.builder()
                .algorithm(algorithm)
                .options(stringOrDefault(safe.get("options"), null))
                .target(stringOrDefault(safe.get("target"), null))
                .build();
    }

    @Override
    public WekaModelState train(WekaModelState state, List<Map<String, Object>> data, Map<String, Object> options) {
        String target = stringOrDefault(options == null ? null : options.get("target"), state.getTarget());
        Instances dataset = WekaDatasetUtil.toInstances(TYPE, data, target);
        try {
            Classifier classifier = AlgorithmUtil.getClassifierInstance(state.getAlgorithm());
            AlgorithmUtil.setClassifierOptions(classifier, state.getOptions());
            log.info("🧠 Training {} on {} rows, class='{}', classification={}",
                    state.getAlgorithm(), dataset.numInstances(), dataset.classAttribute().name(),
                    AlgorithmUtil.isClassification(dataset));
            classifier.buildClassifier(dataset);
            return state.toBuilder()
                    .target(dataset.classAttribute().name())
                    .classifier(classifier)
                    .header(new Instances(dataset, 0))
                    .build();
        } catch (Exception e) {
            throw new ModelExecutionException("Weka training failed for " + state.getAlgorithm() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> predict(WekaModelState state, List<Map<String, Object>> data, Map<String, Object> options) {
        if (data == null) {
            throw new IllegalArgumentException("Prediction data is required");
        }
        if (state.getClassifier() == null || state.getHeader() == null) {
            throw new IllegalStateException("Model instance has not been trained");
        }
        Instances header = state.getHeader();
        List<Map<String, Object>> out = new ArrayList<>(data.size());
        for (Map<String, Object> row : data) {
            Instance instance = WekaDatasetUtil.toInstance(header, row, true);
            Map<String, Object> result = new LinkedHashMap<>(row);
            try {
                double value = state.getClassifier().classifyInstance(instance);
                result.put(PREDICTION_COLUMN, header.classAttribute().isNominal()
                        ? header.classAttribute().value((int) value)
                        : value);
            } catch (Exception e) {
                throw new ModelExecutionException("Weka prediction failed: " + e.getMessage(), e);
            }
            out.add(result);
        }
        return out;
    }

    @Override
    public byte[] serialize(WekaModelState state) throws IOException {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            SerializationHelper.write(bos, state);
            return bos.toByteArray();
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Could not serialize Weka model", e);
        }
    }

    @Override
    public WekaModelState deserialize(byte[] bytes) throws IOException {
        try (ByteArrayInputStream bis = new ByteArrayInputStream(bytes)) {
            return (WekaModelState) SerializationHelper.read(bis);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Could not deserialize Weka model", e);
        }
    }

    private static String stringOrDefault(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? fallback : text;
    }
}
