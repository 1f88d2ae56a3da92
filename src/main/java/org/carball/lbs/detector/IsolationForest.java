package org.carball.lbs.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over a single numeric feature (Liu, Ting and Zhou, 2008). Trees are grown on
 * random sub-samples with random split points; points that isolate in few splits score close
 * to 1, ordinary points score around 0.5 or lower. Seeded, so a fit is reproducible.
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int numTrees;
    private final int maxSamples;
    private final long seed;

    private final List<Node> trees = new ArrayList<>();
    private int sampleSize;

    public IsolationForest(int numTrees, int maxSamples, long seed) {
        if (numTrees < 1) {
            throw new IllegalArgumentException("Number of trees must be positive: " + numTrees);
        }
        if (maxSamples < 2) {
            throw new IllegalArgumentException("Sample size must be at least 2: " + maxSamples);
        }
        this.numTrees = numTrees;
        this.maxSamples = maxSamples;
        this.seed = seed;
    }

    public IsolationForest fit(double[] values) {
        if (values.length < 2) {
            throw new IllegalArgumentException("Isolation forest needs at least 2 values, got " + values.length);
        }
        Random random = new Random(seed);
        sampleSize = Math.min(maxSamples, values.length);
        int heightLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        trees.clear();
        for (int t = 0; t < numTrees; t++) {
            double[] sample = subSample(values, sampleSize, random);
            trees.add(grow(sample, 0, heightLimit, random));
        }
        return this;
    }

    /**
     * Anomaly score in (0, 1].
     */
    public double score(double value) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Isolation forest has not been fitted");
        }
        double totalPath = 0.0;
        for (Node tree : trees) {
            totalPath += pathLength(tree, value, 0);
        }
        double meanPath = totalPath / trees.size();
        return Math.pow(2.0, -meanPath / averagePathLength(sampleSize));
    }

    public double[] scoreAll(double[] values) {
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = score(values[i]);
        }
        return scores;
    }

    /**
     * Average path length of an unsuccessful binary search tree lookup among {@code n} points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1) + EULER_GAMMA) - 2.0 * (n - 1) / n;
    }

    private static double[] subSample(double[] values, int size, Random random) {
        double[] pool = values.clone();
        // partial Fisher-Yates
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            double tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        double[] sample = new double[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }

    private static Node grow(double[] data, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || data.length <= 1) {
            return Node.leaf(data.length);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min == max) {
            return Node.leaf(data.length);
        }

        double split = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double v : data) {
            if (v < split) leftCount++;
        }
        double[] left = new double[leftCount];
        double[] right = new double[data.length - leftCount];
        int l = 0;
        int r = 0;
        for (double v : data) {
            if (v < split) {
                left[l++] = v;
            } else {
                right[r++] = v;
            }
        }
        return Node.internal(split,
                grow(left, depth + 1, heightLimit, random),
                grow(right, depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double value, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        return pathLength(value < node.split ? node.left : node.right, value, depth + 1);
    }

    private static final class Node {
        private final double split;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(double split, Node left, Node right, int size) {
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node internal(double split, Node left, Node right) {
            return new Node(split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
