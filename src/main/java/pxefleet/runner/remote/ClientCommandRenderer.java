package pxefleet.runner.remote;

import pxefleet.runner.command.Command;
import pxefleet.runner.command.CommandName;
import pxefleet.runner.command.CommandPlan;

/**
 * Turns parsed instructions into shell command lines for the client-side
 * wrapper. {@code noauto} travels as a token prefix; {@code disablegui} is
 * handled with separate {@code gui_ctl} calls around the instructions.
 */
public final class ClientCommandRenderer {

    static final String GUI_DISABLE = "gui_ctl disable";
    static final String GUI_RESTORE = "gui_ctl restore";

    private final String wrapperPath;

    public ClientCommandRenderer(String wrapperPath) {
        this.wrapperPath = wrapperPath;
    }

    /** Command line for one instruction, e.g. {@code /usr/bin/linbo_wrapper noauto,sync:1}. */
    public String render(Command command, CommandPlan plan) {
        if (command.isFlag()) {
            throw new IllegalArgumentException("Flags are not executed: " + command.token());
        }
        String prefix = plan.hasFlag(CommandName.NOAUTO) ? CommandName.NOAUTO.token() + "," : "";
        return wrapperPath + " " + prefix + command.token();
    }

    public boolean disablesGui(CommandPlan plan) {
        return plan.hasFlag(CommandName.DISABLEGUI);
    }

    /** The GUI comes back unless the client leaves the boot environment anyway. */
    public boolean restoresGui(CommandPlan plan) {
        return disablesGui(plan) && !plan.leavesBootEnvironment();
    }

    public String guiDisable() {
        return GUI_DISABLE;
    }

    public String guiRestore() {
        return GUI_RESTORE;
    }
}
