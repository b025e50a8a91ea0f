package org.buildlens.analyzer.introspection;

public enum MachineChoice {
    BUILD, HOST
}
