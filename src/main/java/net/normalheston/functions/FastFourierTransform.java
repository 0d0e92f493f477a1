/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.functions;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.apache.commons.math3.util.FastMath;

/**
 * Forward discrete Fourier transform
 * \[ X_{k} = \sum_{n=0}^{M-1} x_{n} e^{-2 \pi i n k / M}, \quad k = 0, \ldots, M-1 \]
 * of data given as separate real and imaginary parts.
 *
 * It is a functional wrapper around the radix-2 transform of Apache commons math. For grid sizes which are not
 * a power of two the transform is expressed as a convolution (Bluestein's chirp-z algorithm) which is then
 * carried out by radix-2 transforms of a padded length.
 *
 * @author normalheston-lib authors
 */
public class FastFourierTransform {

    private FastFourierTransform() {
    }

    /**
     * Returns the forward transform of the given data. The arguments are not modified.
     *
     * @param real Real parts of \( x_{n} \).
     * @param imaginary Imaginary parts of \( x_{n} \), same length as <code>real</code>.
     * @return Array <code>{ Re(X), Im(X) }</code>.
     */
    public static double[][] transform(double[] real, double[] imaginary) {
        if(real.length != imaginary.length) {
            throw new IllegalArgumentException("Real and imaginary parts have different lengths: " + real.length + " != " + imaginary.length + ".");
        }

        int length = real.length;
        if(length == 0) {
            return new double[][] { new double[0], new double[0] };
        }

        if(ArithmeticUtils.isPowerOfTwo(length)) {
            double[][] data = new double[][] { real.clone(), imaginary.clone() };
            FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);
            return data;
        }
        else {
            return transformBluestein(real, imaginary);
        }
    }

    public static boolean isPowerOfTwo(int length) {
        return length > 0 && ArithmeticUtils.isPowerOfTwo(length);
    }

    private static double[][] transformBluestein(double[] real, double[] imaginary) {
        int length = real.length;

        int paddedLength = Integer.highestOneBit(2 * length - 1);
        if(paddedLength < 2 * length - 1) {
            paddedLength <<= 1;
        }

        // Chirp w[n] = exp(-i pi n^2 / M). n^2 is reduced modulo 2M to keep the angle accurate.
        double[] chirpCos = new double[length];
        double[] chirpSin = new double[length];
        long modulus = 2L * length;
        for(int n = 0; n < length; n++) {
            long nSquaredModulo = ((long)n * n) % modulus;
            double angle = FastMath.PI * nSquaredModulo / length;
            chirpCos[n] = FastMath.cos(angle);
            chirpSin[n] = -FastMath.sin(angle);
        }

        double[][] a = new double[2][paddedLength];
        for(int n = 0; n < length; n++) {
            a[0][n] = real[n] * chirpCos[n] - imaginary[n] * chirpSin[n];
            a[1][n] = real[n] * chirpSin[n] + imaginary[n] * chirpCos[n];
        }

        double[][] b = new double[2][paddedLength];
        b[0][0] = chirpCos[0];
        b[1][0] = -chirpSin[0];
        for(int n = 1; n < length; n++) {
            b[0][n] = chirpCos[n];
            b[1][n] = -chirpSin[n];
            b[0][paddedLength - n] = chirpCos[n];
            b[1][paddedLength - n] = -chirpSin[n];
        }

        FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.FORWARD);
        FastFourierTransformer.transformInPlace(b, DftNormalization.STANDARD, TransformType.FORWARD);

        for(int k = 0; k < paddedLength; k++) {
            double re = a[0][k] * b[0][k] - a[1][k] * b[1][k];
            double im = a[0][k] * b[1][k] + a[1][k] * b[0][k];
            a[0][k] = re;
            a[1][k] = im;
        }

        FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.INVERSE);

        double[][] result = new double[2][length];
        for(int k = 0; k < length; k++) {
            result[0][k] = a[0][k] * chirpCos[k] - a[1][k] * chirpSin[k];
            result[1][k] = a[0][k] * chirpSin[k] + a[1][k] * chirpCos[k];
        }
        return result;
    }
}
