package com.kiln.internal.components;

import com.kiln.ui.Ui;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class RecordingUi implements Ui {

    public final List<String> said = Collections.synchronizedList(new ArrayList<>());
    public final List<String> errors = Collections.synchronizedList(new ArrayList<>());
    public final List<List<String>> machine = Collections.synchronizedList(new ArrayList<>());

    @Override
    public String ask(String query) {
        return "";
    }

    @Override
    public void say(String message) {
        said.add(message);
    }

    @Override
    public void message(String message) {
        said.add(message);
    }

    @Override
    public void error(String message) {
        errors.add(message);
    }

    @Override
    public void machine(String type, String... data) {
        List<String> event = new ArrayList<>();
        event.add(type);
        event.addAll(List.of(data));
        machine.add(event);
    }

    public boolean saidContaining(String fragment) {
        synchronized (said) {
            return said.stream().anyMatch(s -> s.contains(fragment));
        }
    }
}
