package org.broadinstitute.msa.testutils;

import org.broadinstitute.msa.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.msa.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for command line argument lists with convenience methods for the standard input and output arguments.
 *
 * Use this only in test code.
 */
public final class ArgumentsBuilder {
    private final List<String> args= new ArrayList<>();

    public ArgumentsBuilder(){}

    /**
     * add an argument with a given value to this builder.
     *
     * This is the fundamental add method that others invoke.  It adds dashes to the argument name.
     */
    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentValue);
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        args.add(argumentValue);
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file){
        Utils.nonNull(file);
        return add(argumentName, file.getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final Enum<?> enummerationValue){
        Utils.nonNull(enummerationValue);
        return add(argumentName, enummerationValue.name());
    }

    public ArgumentsBuilder addInput(final File input) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addOutput(final File output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    /**
     * Add a boolean flag argument, which takes no value.
     */
    public ArgumentsBuilder addFlag(final String argumentName) {
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        return this;
    }

    public List<String> getArgsList(){
        return args;
    }

    @Override
    public String toString(){
        return String.join(" ", args);
    }
}
