package com.kiln.internal.components.hook;

import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.ui.Ui;

public final class EchoHook implements Hook {

    @Override
    public void run(String name, Ui ui, ConfigBundle data) {
        ui.say("Running hook: " + name);
    }

    @Override
    public void cancel() {
    }
}
