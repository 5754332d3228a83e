package dev.nabla.net;

import dev.nabla.net.layers.Layers;
import dev.nabla.net.math.FastRandom;
import dev.nabla.net.math.Tensor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentEvaluationTest {

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testContextsShareNetworkAcrossThreads() throws Exception {
        FastRandom random = new FastRandom(99);
        Network net = Network.newBuilder()
                .then(Layers.relu(8, 16, random))
                .add(Layers.linear(16, 16, random), 1)
                .add(Layers.relu(16, 16, random), 1)
                .add(Layers.sum(2), 2, 3)
                .then(Layers.linear(16, 4, random))
                .then(Layers.softmax())
                .build();

        Random data = new Random(5);
        int samples = 64;
        double[][] inputs = new double[samples][];
        double[][] seeds = new double[samples][];
        double[][] expected = new double[samples][];
        for (int s = 0; s < samples; s++) {
            inputs[s] = GradientCheck.randomVector(data, 8);
            seeds[s] = GradientCheck.randomVector(data, 4);
            EvaluationContext reference = EvaluationContext.allocate(net, inputs[s]);
            expected[s] = flatten(reference.gradient(seeds[s]));
        }

        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<double[][]>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    EvaluationContext context = EvaluationContext.of(net);
                    double[][] results = new double[samples][];
                    for (int s = 0; s < samples; s++) {
                        context.evaluate(inputs[s]);
                        results[s] = flatten(context.gradient(seeds[s]));
                    }
                    return results;
                }));
            }

            for (Future<double[][]> future : futures) {
                double[][] results = future.get();
                for (int s = 0; s < samples; s++)
                    assertArrayEquals(expected[s], results[s]);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static double[] flatten(List<Tensor> tensors) {
        int size = 0;
        for (Tensor t : tensors)
            size += t.size();
        double[] flat = new double[size];
        int offset = 0;
        for (Tensor t : tensors) {
            System.arraycopy(t.data(), 0, flat, offset, t.size());
            offset += t.size();
        }
        return flat;
    }
}
