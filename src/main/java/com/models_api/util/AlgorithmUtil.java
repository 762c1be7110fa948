package com.models_api.util;

import lombok.extern.slf4j.Slf4j;
import weka.classifiers.Classifier;
import weka.core.Instances;
import weka.core.OptionHandler;
import weka.core.Utils;

import java.lang.reflect.Constructor;

@Slf4j
public class AlgorithmUtil {

    private AlgorithmUtil() {
    }

    public static boolean isClassifier(String algorithmClassName) {
        try {
            Class<?> cls = Class.forName(algorithmClassName);
            return Classifier.class.isAssignableFrom(cls);
        } catch (ClassNotFoundException e) {
            log.warn("Classifier class not found for algorithm: {}", algorithmClassName);
            return false;
        }
    }

    public static boolean isClassification(Instances data) {
        return data.classAttribute().isNominal();
    }

    public static Classifier getClassifierInstance(String algorithmClassName) throws Exception {
        Class<?> clazz = Class.forName(algorithmClassName);
        Constructor<?> constructor = clazz.getConstructor();
        return (Classifier) constructor.newInstance();
    }

    public static void setClassifierOptions(Classifier classifier, String rawOptions) throws Exception {
        if (rawOptions == null || rawOptions.isBlank()) {
            return;
        }
        if (classifier instanceof OptionHandler handler) {
            handler.setOptions(Utils.splitOptions(rawOptions));
        } else {
            log.warn("⚠️ {} does not accept options, ignoring '{}'", classifier.getClass().getSimpleName(), rawOptions);
        }
    }
}
