package com.gamepanel.scheduler.dispatch;

import com.gamepanel.scheduler.model.PowerAction;

/**
 * Client of the remote daemon that actually performs task actions.
 *
 * <p>Each call returns once the daemon has accepted or rejected the request; it does not wait for the
 * daemon-side effect to finish. Implementations bound every call with their own timeout and report it as
 * {@link DispatchResult.Status#TIMED_OUT}.</p>
 */
public interface ActionDispatcher {

    DispatchResult powerAction(String serverId, PowerAction action);

    DispatchResult createBackup(String serverId);

    DispatchResult runCommand(String serverId, String command);
}
