package com.convexlab.modeling.binding;

import com.convexlab.modeling.store.TableView;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything a binder needs besides the variable and scenario: the problem
 * being built, the data it reads and the decision variables it creates.
 */
@Value
@Builder
public class BindingContext {

    @NonNull
    String problemName;

    @NonNull
    TableView dataView;

    @NonNull
    DecisionSpace decisionSpace;
}
