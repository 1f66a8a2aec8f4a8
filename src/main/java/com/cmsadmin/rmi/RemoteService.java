package com.cmsadmin.rmi;

import java.rmi.Remote;
import java.rmi.RemoteException;

/**
 * Remote interface exposed by every backend service shard.
 * MUST extend Remote to be usable via RMI.
 * Every method MUST declare RemoteException.
 *
 * Application errors travel back inside the RpcReply,
 * RemoteException is reserved for transport failures.
 */
public interface RemoteService extends Remote {
    /**
     * Executes a named method on this shard.
     * @param request method name, arguments and the transport call id
     * @return reply carrying the same call id and either a result or an error
     * @throws RemoteException if RMI communication fails
     */
    RpcReply invoke(RpcRequest request) throws RemoteException;

    /**
     * Liveness probe, used when re-establishing a dropped channel.
     * @return true if the shard responds
     * @throws RemoteException if RMI communication fails
     */
    boolean ping() throws RemoteException;
}
