package Model;

import dev.brachtendorf.jimagehash.hash.Hash;
import dev.brachtendorf.jimagehash.hashAlgorithms.AverageHash;
import dev.brachtendorf.jimagehash.hashAlgorithms.DifferenceHash;
import dev.brachtendorf.jimagehash.hashAlgorithms.HashingAlgorithm;
import dev.brachtendorf.jimagehash.hashAlgorithms.PerceptiveHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;

public final class HashExtractor {

    private static final Logger log = LoggerFactory.getLogger(HashExtractor.class);

    public static final int HASH_BITS = 64;
    public static final int INCOMPARABLE = 999;
    public static final String HASH_ERROR = "hash_error";

    static final int DIFFERENCE_RESOLUTION = differenceResolution();

    public record Result(PerceptualHashes hashes, boolean failed) {}

    private final int maxDimension;

    // jimagehash algorithms cache key resolution and DCT tables lazily, one set per worker thread
    private final ThreadLocal<Map<HashFamily, HashingAlgorithm>> algorithms =
            ThreadLocal.withInitial(HashExtractor::createAlgorithms);

    public HashExtractor(int maxDimension) {
        this.maxDimension = maxDimension;
    }

    public Result extract(BufferedImage image) {
        BufferedImage scaled;
        try {
            scaled = downsample(image, maxDimension);
        } catch (RuntimeException e) {
            log.warn("Cannot prepare image for hashing: {}", e.toString());
            return new Result(PerceptualHashes.EMPTY, true);
        }

        Map<HashFamily, String> hex = new EnumMap<>(HashFamily.class);
        boolean failed = false;
        for (Map.Entry<HashFamily, HashingAlgorithm> e : algorithms.get().entrySet()) {
            try {
                hex.put(e.getKey(), toHex(e.getValue().hash(scaled)));
            } catch (RuntimeException ex) {
                log.warn("{} hash failed: {}", e.getKey(), ex.toString());
                hex.put(e.getKey(), PerceptualHashes.SENTINEL);
                failed = true;
            }
        }

        return new Result(new PerceptualHashes(
                hex.get(HashFamily.AVERAGE),
                hex.get(HashFamily.DIFFERENCE),
                hex.get(HashFamily.PERCEPTIVE)), failed);
    }

    public static int hammingDistance(String h1, String h2) {
        if (h1 == null || h2 == null || h1.isEmpty() || h2.isEmpty() || h1.length() != h2.length()) {
            return INCOMPARABLE;
        }
        try {
            BigInteger x = new BigInteger(h1, 16).xor(new BigInteger(h2, 16));
            return x.bitCount();
        } catch (NumberFormatException e) {
            return INCOMPARABLE;
        }
    }

    public static int minDistance(PerceptualHashes a, PerceptualHashes b) {
        int min = INCOMPARABLE;
        for (HashFamily f : HashFamily.values()) {
            min = Math.min(min, hammingDistance(a.get(f), b.get(f)));
        }
        return min;
    }

    static String toHex(Hash hash) {
        // keep the low HASH_BITS bits so every family compares on the same scale
        BigInteger mask = BigInteger.ONE.shiftLeft(HASH_BITS).subtract(BigInteger.ONE);
        String hex = hash.getHashValue().and(mask).toString(16);

        int width = HASH_BITS / 4;
        if (hex.length() >= width) return hex;
        return "0".repeat(width - hex.length()) + hex;
    }

    static BufferedImage downsample(BufferedImage src, int maxDimension) {
        int w = src.getWidth();
        int h = src.getHeight();
        if (w <= maxDimension && h <= maxDimension) return src;

        double scale = Math.min((double) maxDimension / w, (double) maxDimension / h);
        int nw = Math.max(1, (int) Math.round(w * scale));
        int nh = Math.max(1, (int) Math.round(h * scale));

        BufferedImage dst = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = dst.createGraphics();
        g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2.drawImage(src, 0, 0, nw, nh, null);
        g2.dispose();
        return dst;
    }

    private static Map<HashFamily, HashingAlgorithm> createAlgorithms() {
        Map<HashFamily, HashingAlgorithm> m = new EnumMap<>(HashFamily.class);
        m.put(HashFamily.AVERAGE, new AverageHash(HASH_BITS));
        m.put(HashFamily.DIFFERENCE, new DifferenceHash(DIFFERENCE_RESOLUTION, DifferenceHash.Precision.Simple));
        m.put(HashFamily.PERCEPTIVE, new PerceptiveHash(HASH_BITS));
        return m;
    }

    // DifferenceHash rounds the requested resolution up to its gradient grid, so 64 yields 72 bits
    private static int differenceResolution() {
        BufferedImage blank = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
        for (int requested = HASH_BITS; requested >= HASH_BITS / 2; requested--) {
            int bits = new DifferenceHash(requested, DifferenceHash.Precision.Simple).hash(blank).getBitResolution();
            if (bits == HASH_BITS) return requested;
        }
        log.warn("No DifferenceHash resolution yields exactly {} bits; truncating to the low bits", HASH_BITS);
        return HASH_BITS;
    }
}
