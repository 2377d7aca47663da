package io.github.eutro.ljdecomp.core.diag;

public enum Severity {
    INFO,
    WARNING,
    ERROR,
}
