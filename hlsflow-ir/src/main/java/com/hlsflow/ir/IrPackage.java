package com.hlsflow.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * IR 包：函数、proc 与通道的集合。
 */
public class IrPackage {

    private final String name;
    private final Map<String, IrFunction> functions = new LinkedHashMap<>();
    private final Map<String, IrProc> procs = new LinkedHashMap<>();
    private final Map<String, IrChannel> channels = new LinkedHashMap<>();
    private String topName;

    public IrPackage(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public IrFunction addFunction(IrFunction function) {
        if (functions.containsKey(function.getName())) {
            throw new IllegalArgumentException("Duplicate function: " + function.getName());
        }
        functions.put(function.getName(), function);
        return function;
    }

    public IrFunction getFunction(String functionName) {
        return functions.get(functionName);
    }

    public boolean hasFunction(String functionName) {
        return functions.containsKey(functionName);
    }

    public void removeFunction(String functionName) {
        functions.remove(functionName);
    }

    public List<IrFunction> getFunctions() {
        return new ArrayList<>(functions.values());
    }

    public IrProc addProc(IrProc proc) {
        if (procs.containsKey(proc.getName())) {
            throw new IllegalArgumentException("Duplicate proc: " + proc.getName());
        }
        procs.put(proc.getName(), proc);
        return proc;
    }

    public IrProc getProc(String procName) {
        return procs.get(procName);
    }

    public List<IrProc> getProcs() {
        return new ArrayList<>(procs.values());
    }

    public IrChannel addChannel(IrChannel channel) {
        if (channels.containsKey(channel.getName())) {
            throw new IllegalArgumentException("Duplicate channel: " + channel.getName());
        }
        channels.put(channel.getName(), channel);
        return channel;
    }

    public IrChannel getChannel(String channelName) {
        return channels.get(channelName);
    }

    public List<IrChannel> getChannels() {
        return new ArrayList<>(channels.values());
    }

    /** 所有函数与 proc */
    public List<IrFunctionBase> getFunctionBases() {
        List<IrFunctionBase> all = new ArrayList<>(functions.values());
        all.addAll(procs.values());
        return all;
    }

    public String getTopName() {
        return topName;
    }

    public void setTopName(String topName) {
        this.topName = topName;
    }

    /** 在包内唯一的函数名 */
    public String uniqueFunctionName(String base) {
        if (!functions.containsKey(base) && !procs.containsKey(base)) {
            return base;
        }
        int suffix = 1;
        while (functions.containsKey(base + "_" + suffix) || procs.containsKey(base + "_" + suffix)) {
            suffix++;
        }
        return base + "_" + suffix;
    }

    @Override
    public String toString() {
        return "package " + name;
    }
}
