package com.cmsadmin.rpc;

import com.cmsadmin.rmi.RemoteService;
import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceCoord;

import java.rmi.NotBoundException;
import java.rmi.RemoteException;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;

/**
 * Looks services up in the RMI registry of their shard.
 * Every shard runs its own registry and binds itself under the service name.
 */
public class RmiServiceLocator implements ServiceLocator {

    @Override
    public RemoteService locate(ServiceCoord coord, ServiceAddress address) throws RemoteException, NotBoundException {
        Registry registry = LocateRegistry.getRegistry(address.getHost(), address.getPort());
        return (RemoteService) registry.lookup(bindingName(coord));
    }

    /**
     * Name under which a shard binds itself in its own registry.
     */
    public static String bindingName(ServiceCoord coord) {
        return coord.getName();
    }
}
