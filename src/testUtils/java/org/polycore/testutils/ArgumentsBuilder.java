package org.polycore.testutils;

import org.apache.commons.lang3.StringUtils;
import org.polycore.cmdline.StandardArgumentDefinitions;
import org.polycore.utils.Utils;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for command line argument lists.
 * Use {@link #add} for arguments with a value, {@link #addFlag} for boolean flags and {@link #addRaw} for anything
 * else; values are converted to strings.
 */
public final class ArgumentsBuilder {
    private final List<String> args= new ArrayList<>();

    public ArgumentsBuilder(){}

    public ArgumentsBuilder addRaw(String arg){
        List<String> chunks = Arrays.asList(StringUtils.split(arg.trim()));
        for (String chunk : chunks){
            args.add(chunk);
        }
        return this;
    }

    // ARGUMENT/VALUE METHODS

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

    public ArgumentsBuilder add(final String argumentName, final Path path){
        Utils.nonNull(path);
        return add(argumentName, path.toAbsolutePath().toString());
    }

    public ArgumentsBuilder add(final String argumentName, final Number value){
        Utils.nonNull(value);
        return add(argumentName, value.toString());
    }

    public ArgumentsBuilder add(final String argumentName, final Enum<?> enumerationValue){
        Utils.nonNull(enumerationValue);
        return add(argumentName, enumerationValue.name());
    }

    //FLAG

    public ArgumentsBuilder addFlag(final String argumentName) {
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        return this;
    }

    // CONVENIENCE METHODS WITH BUILT-IN STANDARD ARGUMENTS

    public ArgumentsBuilder addOutput(final Path output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    public ArgumentsBuilder addReference(final Path reference){
        return add(StandardArgumentDefinitions.REFERENCE_LONG_NAME, reference);
    }

    public ArgumentsBuilder addSample(final Path sample){
        return add(StandardArgumentDefinitions.SAMPLE_LONG_NAME, sample);
    }

    public List<String> getArgsList(){
        return args;
    }

    public String[] getArgsArray(){
        return args.toArray(new String[this.args.size()]);
    }

    @Override
    public String toString(){
        return String.join(" ", args);
    }
}
