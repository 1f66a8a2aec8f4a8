package com.cmsadmin.rpc;

import com.cmsadmin.rmi.RemoteService;
import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceCoord;

import java.rmi.NotBoundException;
import java.rmi.RemoteException;

/**
 * Obtains a reference to the remote object of a service shard.
 */
@FunctionalInterface
public interface ServiceLocator {
    /**
     * @param coord service shard being looked up
     * @param address where its registry lives
     * @return remote reference (a stub for RMI)
     * @throws RemoteException if the registry cannot be reached
     * @throws NotBoundException if the registry does not know the service
     */
    RemoteService locate(ServiceCoord coord, ServiceAddress address) throws RemoteException, NotBoundException;
}
