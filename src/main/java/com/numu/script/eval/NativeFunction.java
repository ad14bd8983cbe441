package com.numu.script.eval;

import java.util.List;

/** Functional interface for host-provided functions. Arguments arrive already evaluated, left to right. */
public interface NativeFunction {
    double call(List<Double> args);
}
