/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

/**
 * The two families of backends a program can be dispatched to.
 */
public enum BackendKind {

    /** linear and mixed-integer linear programs */
    LINEAR,

    /** nonlinear programs, possibly with integer variables */
    NONLINEAR;
}
