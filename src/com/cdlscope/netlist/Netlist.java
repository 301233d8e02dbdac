/*
 * Copyright (c) 2026, CDLScope Authors.
 * All rights reserved.
 *
 * This file is part of CDLScope.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.cdlscope.netlist;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * The in-memory model of a design: cells, pins, nets and ports, each indexed by
 * id and (except pins, whose local names repeat across cells) by name.
 *
 * Adding an object with an id or name that is already present fails at once.
 * References between objects are not checked on insertion, so the netlist can
 * be filled in any order; call {@link #validate()} once it is complete.
 */
public class Netlist {

    private final String name;

    private final Map<CellId, Cell> cells = new LinkedHashMap<>();
    private final Map<NetId, Net> nets = new LinkedHashMap<>();
    private final Map<PinId, Pin> pins = new LinkedHashMap<>();
    private final Map<PortId, Port> ports = new LinkedHashMap<>();

    private final Map<String, CellId> cellNames = new HashMap<>();
    private final Map<String, NetId> netNames = new HashMap<>();
    private final Map<String, PortId> portNames = new HashMap<>();

    public Netlist(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    /**
     * @param cell The cell to add
     * @throws IllegalArgumentException if a cell with the same id or name exists
     */
    public void addCell(Cell cell) {
        if (cells.containsKey(cell.getId())) {
            throw new IllegalArgumentException("Cell with id " + cell.getId() + " already exists");
        }
        if (cellNames.containsKey(cell.getName())) {
            throw new IllegalArgumentException("Cell with name " + cell.getName() + " already exists");
        }
        cells.put(cell.getId(), cell);
        cellNames.put(cell.getName(), cell.getId());
    }

    /**
     * @param net The net to add
     * @throws IllegalArgumentException if a net with the same id or name exists
     */
    public void addNet(Net net) {
        if (nets.containsKey(net.getId())) {
            throw new IllegalArgumentException("Net with id " + net.getId() + " already exists");
        }
        if (netNames.containsKey(net.getName())) {
            throw new IllegalArgumentException("Net with name " + net.getName() + " already exists");
        }
        nets.put(net.getId(), net);
        netNames.put(net.getName(), net.getId());
    }

    /**
     * @param pin The pin to add
     * @throws IllegalArgumentException if a pin with the same id exists
     */
    public void addPin(Pin pin) {
        if (pins.containsKey(pin.getId())) {
            throw new IllegalArgumentException("Pin with id " + pin.getId() + " already exists");
        }
        pins.put(pin.getId(), pin);
    }

    /**
     * @param port The port to add
     * @throws IllegalArgumentException if a port with the same id or name exists
     */
    public void addPort(Port port) {
        if (ports.containsKey(port.getId())) {
            throw new IllegalArgumentException("Port with id " + port.getId() + " already exists");
        }
        if (portNames.containsKey(port.getName())) {
            throw new IllegalArgumentException("Port with name " + port.getName() + " already exists");
        }
        ports.put(port.getId(), port);
        portNames.put(port.getName(), port.getId());
    }

    @Nullable
    public Cell getCell(CellId id) {
        return cells.get(id);
    }

    @Nullable
    public Cell getCellByName(String cellName) {
        CellId id = cellNames.get(cellName);
        return id == null ? null : cells.get(id);
    }

    @Nullable
    public Net getNet(NetId id) {
        return nets.get(id);
    }

    @Nullable
    public Net getNetByName(String netName) {
        NetId id = netNames.get(netName);
        return id == null ? null : nets.get(id);
    }

    @Nullable
    public Pin getPin(PinId id) {
        return pins.get(id);
    }

    @Nullable
    public Port getPort(PortId id) {
        return ports.get(id);
    }

    @Nullable
    public Port getPortByName(String portName) {
        PortId id = portNames.get(portName);
        return id == null ? null : ports.get(id);
    }

    public List<Cell> getAllCells() {
        return new ArrayList<>(cells.values());
    }

    public List<Net> getAllNets() {
        return new ArrayList<>(nets.values());
    }

    public List<Pin> getAllPins() {
        return new ArrayList<>(pins.values());
    }

    public List<Port> getAllPorts() {
        return new ArrayList<>(ports.values());
    }

    public List<Cell> getSequentialCells() {
        List<Cell> result = new ArrayList<>();
        for (Cell c : cells.values()) {
            if (c.isSequential()) result.add(c);
        }
        return result;
    }

    public int getCellCount() {
        return cells.size();
    }

    public int getNetCount() {
        return nets.size();
    }

    public int getPinCount() {
        return pins.size();
    }

    public int getPortCount() {
        return ports.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty() && nets.isEmpty() && pins.isEmpty() && ports.isEmpty();
    }

    /**
     * Checks that every reference between the objects of this netlist resolves:
     * pin to net, cell to pin, net to pin and port to net.
     * @return One message per dangling reference, empty when the netlist is
     *         consistent
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        for (Pin pin : pins.values()) {
            NetId netId = pin.getNetId();
            if (netId != null && !nets.containsKey(netId)) {
                errors.add("Pin " + pin.getId() + " references non-existent net " + netId);
            }
        }
        for (Cell cell : cells.values()) {
            for (PinId pinId : cell.getPinIds()) {
                if (!pins.containsKey(pinId)) {
                    errors.add("Cell " + cell.getName() + " references non-existent pin " + pinId);
                }
            }
        }
        for (Net net : nets.values()) {
            for (PinId pinId : net.getPinIds()) {
                if (!pins.containsKey(pinId)) {
                    errors.add("Net " + net.getName() + " references non-existent pin " + pinId);
                }
            }
        }
        for (Port port : ports.values()) {
            NetId netId = port.getNetId();
            if (netId != null && !nets.containsKey(netId)) {
                errors.add("Port " + port.getName() + " references non-existent net " + netId);
            }
        }
        return errors;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "Netlist(" + name + ", empty)";
        }
        return "Netlist(" + name + ", cells=" + cells.size() + ", nets=" + nets.size() + ", pins="
                + pins.size() + ", ports=" + ports.size() + ")";
    }
}
