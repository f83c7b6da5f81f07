package com.convexlab.modeling.build;

public enum ObjectiveSense {
    MINIMIZE,
    MAXIMIZE
}
